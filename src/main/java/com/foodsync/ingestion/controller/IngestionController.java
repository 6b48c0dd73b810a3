package com.foodsync.ingestion.controller;

import com.foodsync.common.dto.ApiResponse;
import com.foodsync.ingestion.IngestionGateway;
import com.foodsync.ingestion.dto.BatchResult;
import com.foodsync.menu.service.MenuSyncResult;
import com.foodsync.menu.service.SyncTrigger;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class IngestionController {

    private final IngestionGateway ingestionGateway;

    /** 요청 시 주문 끌어오기 (웹훅 대신 쓰는 경로) */
    @PostMapping("/api/orders/poll")
    public ApiResponse<BatchResult> pollOrders() {
        return IngestionResponses.of(ingestionGateway.pullOrders());
    }

    @PostMapping("/api/menu/sync")
    public ApiResponse<MenuSyncResult> syncMenu() {
        return ApiResponse.ok(ingestionGateway.syncMenu(SyncTrigger.MANUAL), "Menu synchronized");
    }
}
