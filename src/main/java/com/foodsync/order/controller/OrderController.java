package com.foodsync.order.controller;

import com.foodsync.common.dto.ApiResponse;
import com.foodsync.order.dto.OrderDetailResponse;
import com.foodsync.order.service.OrderQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/orders")
@RequiredArgsConstructor
public class OrderController {

    private final OrderQueryService orderQueryService;

    /** 주문 상세 (아이템, 옵션, 세금, 쿠폰, 고객, 청구 정보 포함) */
    @GetMapping("/{id}")
    public ApiResponse<OrderDetailResponse> getOrder(@PathVariable Long id) {
        return ApiResponse.ok(orderQueryService.getOrderWithDetails(id));
    }
}
