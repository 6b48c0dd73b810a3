package com.foodsync.ingestion.controller;

import com.foodsync.common.dto.ApiResponse;
import com.foodsync.ingestion.dto.BatchResult;

final class IngestionResponses {

    private IngestionResponses() {
    }

    /** 일부 주문이 실패한 배치도 200, 대신 success=false */
    static ApiResponse<BatchResult> of(BatchResult result) {
        if (result.hasFailures()) {
            return ApiResponse.failure(result, result.failures() + " of " + result.count() + " orders failed");
        }
        return ApiResponse.ok(result, result.count() + " orders processed");
    }
}
