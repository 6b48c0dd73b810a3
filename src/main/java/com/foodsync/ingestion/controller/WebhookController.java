package com.foodsync.ingestion.controller;

import com.foodsync.common.dto.ApiResponse;
import com.foodsync.ingestion.IngestionGateway;
import com.foodsync.ingestion.dto.BatchResult;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.web.bind.annotation.*;

/**
 * 주문 푸시 웹훅. API 토큰이 아니라 플랫폼 마스터 키로 인증한다.
 */
@RestController
@RequiredArgsConstructor
public class WebhookController {

    private final IngestionGateway ingestionGateway;

    @PostMapping("/webhook/orders")
    public ApiResponse<BatchResult> receiveOrders(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestBody(required = false) String body) { // 키 확인 전에는 변환하지 않음
        return IngestionResponses.of(ingestionGateway.receivePush(authorization, body));
    }
}
