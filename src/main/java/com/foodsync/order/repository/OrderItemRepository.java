package com.foodsync.order.repository;

import com.foodsync.order.entity.OrderItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface OrderItemRepository extends JpaRepository<OrderItem, Long> {

    @Query("SELECT DISTINCT i FROM OrderItem i LEFT JOIN FETCH i.options " +
            "WHERE i.order.id = :orderId ORDER BY i.id")
    List<OrderItem> findWithOptionsByOrderId(@Param("orderId") Long orderId);
}
