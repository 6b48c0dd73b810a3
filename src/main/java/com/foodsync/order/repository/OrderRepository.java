package com.foodsync.order.repository;

import com.foodsync.order.entity.Order;
import com.foodsync.order.entity.OrderType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

public interface OrderRepository extends JpaRepository<Order, Long> {

    Optional<Order> findByExternalIdAndPosSystemId(Long externalId, Long posSystemId);

    @Query("SELECT o FROM Order o " +
            "LEFT JOIN FETCH o.restaurant " +
            "LEFT JOIN FETCH o.client " +
            "LEFT JOIN FETCH o.billingDetails " +
            "WHERE o.id = :id")
    Optional<Order> findWithDetailsById(@Param("id") Long id);

    long countByCreatedAtGreaterThanEqual(LocalDateTime from);

    @Query("SELECT COALESCE(SUM(o.totalPrice), 0) FROM Order o WHERE o.createdAt >= :from")
    BigDecimal sumTotalPriceSince(@Param("from") LocalDateTime from);

    long countByType(OrderType type);

    List<Order> findTop10ByOrderByCreatedAtDescIdDesc();
}
