package com.foodsync.order.service;

/**
 * 주문 하나의 수집 결과. 중복 키가 이미 있었으면(동시 삽입에서 진 경우 포함) {@code isNew=false}.
 */
public record OrderIngestResult(Long externalId, Long internalId, boolean isNew) {
}
