package com.foodsync.order.service;

import com.foodsync.common.exception.BusinessException;
import com.foodsync.common.exception.ErrorCode;
import com.foodsync.order.dto.OrderDetailResponse;
import com.foodsync.order.entity.Order;
import com.foodsync.order.entity.OrderItem;
import com.foodsync.order.repository.OrderItemRepository;
import com.foodsync.order.repository.OrderRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class OrderQueryService {

    private final OrderRepository orderRepository;
    private final OrderItemRepository orderItemRepository;

    public OrderDetailResponse getOrderWithDetails(Long id) {
        Order order = orderRepository.findWithDetailsById(id)
                .orElseThrow(() -> new BusinessException(ErrorCode.ORDER_NOT_FOUND, "Order not found: " + id));
        List<OrderItem> items = orderItemRepository.findWithOptionsByOrderId(id);
        return OrderDetailResponse.of(order, items);
    }
}
