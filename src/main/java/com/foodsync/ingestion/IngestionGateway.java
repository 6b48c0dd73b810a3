package com.foodsync.ingestion;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.foodsync.common.exception.BusinessException;
import com.foodsync.common.exception.ErrorCode;
import com.foodsync.eventlog.EventLogService;
import com.foodsync.eventlog.EventType;
import com.foodsync.gloriafood.GloriaFoodFetcher;
import com.foodsync.gloriafood.GloriaFoodProperties;
import com.foodsync.ingestion.dto.BatchResult;
import com.foodsync.ingestion.dto.OrderOutcome;
import com.foodsync.menu.service.MenuSyncResult;
import com.foodsync.menu.service.MenuTreeSynchronizer;
import com.foodsync.menu.service.SyncTrigger;
import com.foodsync.order.payload.OrderBatch;
import com.foodsync.order.service.OrderIngestResult;
import com.foodsync.order.service.OrderNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 수집 게이트웨이 (Ingestion Gateway) - 주문/메뉴 두 파이프라인의 진입점.
 *
 * <p>주문 배치는 플랫폼이 웹훅으로 밀어 넣거나(push) 요청 시 끌어온다(poll).
 * 메뉴 동기화는 수동 호출 또는 스케줄로 실행된다.</p>
 *
 * <h3>배치 처리 흐름</h3>
 * <pre>
 * 1. push: 마스터 키 확인 → 본문을 OrderBatch로 변환
 *    poll: GloriaFoodFetcher.popOrders()
 * 2. 주문마다 OrderNormalizer.ingest() → 주문 하나 = 트랜잭션 하나
 * 3. 실패한 주문은 결과 항목에 에러로 남기고 다음 주문 계속
 * 4. 배치마다 order_received 이벤트 한 건 (실패가 있으면 error)
 * </pre>
 *
 * <h3>★ 인증 실패도 기록</h3>
 * <p>마스터 키가 틀리면 본문을 읽기 전에 거부하고 error 이벤트를 남긴다.
 * 본문이 깨져 있어도 키 검사가 먼저다.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionGateway {

    static final String SOURCE_PUSH = "push"; // 웹훅으로 받은 배치
    static final String SOURCE_POLL = "poll"; // 플랫폼에서 꺼내 온 배치
    static final String INVALID_MASTER_KEY = "Invalid master key";

    private final OrderNormalizer orderNormalizer;
    private final MenuTreeSynchronizer menuTreeSynchronizer;
    private final GloriaFoodFetcher gloriaFoodFetcher;
    private final EventLogService eventLogService;
    private final GloriaFoodProperties gloriaFoodProperties;
    private final ObjectMapper objectMapper;

    /**
     * 웹훅 배치 수신. 본문은 문자열 그대로 받아서 마스터 키 확인 뒤에 변환한다.
     *
     * @param authorization 요청의 {@code Authorization} 헤더 (마스터 키)
     * @param body          변환 전 요청 본문
     * @throws BusinessException 키 불일치 시 {@code UNAUTHORIZED_WEBHOOK},
     *                           배치 형식이 아니면 {@code INVALID_INPUT}
     */
    public BatchResult receivePush(String authorization, String body) {
        if (!isMasterKey(authorization)) {
            log.warn("Order push rejected: {}", INVALID_MASTER_KEY);
            recordPushError(INVALID_MASTER_KEY);
            throw new BusinessException(ErrorCode.UNAUTHORIZED_WEBHOOK);
        }
        return processBatch(SOURCE_PUSH, readBatch(body));
    }

    /** 플랫폼에서 대기 주문을 꺼내 처리. 조회 실패는 error 이벤트 후 그대로 던진다. */
    public BatchResult pullOrders() {
        OrderBatch batch;
        try {
            batch = gloriaFoodFetcher.popOrders();
        } catch (BusinessException e) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("source", SOURCE_POLL);
            payload.put("error", e.getMessage());
            eventLogService.error(EventType.ORDER_RECEIVED, payload, e.getMessage());
            throw e;
        }
        return processBatch(SOURCE_POLL, batch);
    }

    public BatchResult processBatch(String source, OrderBatch batch) {
        List<JsonNode> orders = batch != null ? batch.ordersOrEmpty() : List.of();
        List<OrderOutcome> outcomes = new ArrayList<>(orders.size());

        for (JsonNode rawOrder : orders) {
            outcomes.add(ingestOne(rawOrder));
        }

        BatchResult result = new BatchResult(source, orders.size(), outcomes);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("source", source);
        payload.put("count", result.count());
        payload.put("orders", outcomes);

        if (result.hasFailures()) {
            String message = result.failures() + " of " + result.count() + " orders failed";
            log.warn("Order batch from {} processed with failures: {}", source, message);
            eventLogService.error(EventType.ORDER_RECEIVED, payload, message);
        } else {
            log.info("Order batch from {} processed: count={}", source, result.count());
            eventLogService.success(EventType.ORDER_RECEIVED, payload);
        }
        return result;
    }

    public MenuSyncResult syncMenu(SyncTrigger trigger) {
        return menuTreeSynchronizer.sync(trigger);
    }

    private OrderOutcome ingestOne(JsonNode rawOrder) {
        Long externalId = externalIdOf(rawOrder);
        try {
            OrderIngestResult ingested = orderNormalizer.ingest(rawOrder);
            return OrderOutcome.stored(ingested);
        } catch (BusinessException e) {
            log.warn("Order rejected: externalId={}, code={}, reason={}", externalId, e.getErrorCode(), e.getMessage());
            return OrderOutcome.failed(externalId, e.getMessage());
        } catch (RuntimeException e) {
            // 예상 못 한 예외도 이 주문에서 멈춘다
            log.error("Order failed: externalId={}", externalId, e);
            return OrderOutcome.failed(externalId, e.getMessage());
        }
    }

    private OrderBatch readBatch(String body) {
        if (!StringUtils.hasText(body)) {
            return new OrderBatch(0, null);
        }
        try {
            return objectMapper.readValue(body, OrderBatch.class);
        } catch (JsonProcessingException e) {
            String message = "Malformed order batch: " + e.getOriginalMessage();
            log.warn("Order push rejected: {}", message);
            recordPushError(message);
            throw new BusinessException(ErrorCode.INVALID_INPUT, message, e);
        }
    }

    private void recordPushError(String message) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("source", SOURCE_PUSH);
        payload.put("error", message);
        eventLogService.error(EventType.ORDER_RECEIVED, payload, message);
    }

    private boolean isMasterKey(String authorization) {
        String masterKey = gloriaFoodProperties.masterKey();
        return authorization != null && masterKey != null && !masterKey.isEmpty()
                && authorization.equals(masterKey);
    }

    private static Long externalIdOf(JsonNode rawOrder) {
        if (rawOrder == null) {
            return null;
        }
        JsonNode id = rawOrder.path("id");
        return id.canConvertToLong() ? id.asLong() : null;
    }
}
