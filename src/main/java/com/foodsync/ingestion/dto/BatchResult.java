package com.foodsync.ingestion.dto;

import java.util.List;

/**
 * 배치 처리 결과.
 *
 * @param source   {@code push} 또는 {@code poll}
 * @param count    배치의 주문 수
 * @param orders   주문별 결과, 배치 순서 그대로
 */
public record BatchResult(String source, int count, List<OrderOutcome> orders) {

    public long failures() {
        return orders.stream().filter(OrderOutcome::isFailed).count();
    }

    public boolean hasFailures() {
        return failures() > 0;
    }
}
