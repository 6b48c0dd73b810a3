package com.foodsync.order.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * 웹훅 본문과 풀 응답의 공통 봉투.
 * 주문은 JsonNode로 받아 두고 하나씩 따로 파싱한다. 주문 하나가 깨져도 배치 전체가 거부되지 않는다.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record OrderBatch(int count, List<JsonNode> orders) {

    public List<JsonNode> ordersOrEmpty() {
        return orders != null ? orders : List.of();
    }
}
