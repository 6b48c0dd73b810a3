package com.foodsync.ingestion.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.foodsync.order.service.OrderIngestResult;

/**
 * 배치 안 주문 하나의 결과. 저장된 주문 정보 또는 에러 메시지.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OrderOutcome(Long externalId, Long orderId, Boolean isNew, String error) {

    public static OrderOutcome stored(OrderIngestResult result) {
        return new OrderOutcome(result.externalId(), result.internalId(), result.isNew(), null);
    }

    public static OrderOutcome failed(Long externalId, String error) {
        return new OrderOutcome(externalId, null, null, error);
    }

    @JsonIgnore
    public boolean isFailed() {
        return error != null;
    }
}
