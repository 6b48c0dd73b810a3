package com.foodsync.order.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.foodsync.common.exception.BusinessException;
import com.foodsync.common.exception.ErrorCode;
import com.foodsync.order.entity.Order;
import com.foodsync.order.payload.ExternalOrder;
import com.foodsync.order.repository.OrderRepository;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 주문 정규화 (Order Normalizer) - 원본 주문 하나를 관계형 행으로 바꾼다.
 *
 * <p>중복 기준은 (외부 주문 id, POS 시스템 id) 하나뿐이고, 같은 키는 정확히 한 번만 저장된다.</p>
 *
 * <h3>처리 흐름</h3>
 * <pre>
 * 1. parse()    JSON → ExternalOrder, Bean Validation  (쓰기 전에 거부)
 * 2. write()    OrderWriter, 주문 하나 = 트랜잭션 하나
 * 3. 유니크 키 충돌 시
 *    ├─ 주문 행이 이미 있음 → 이긴 쪽 행을 읽어 isNew=false
 *    └─ 고객/매장 행 충돌  → 한 번만 재시도
 * 4. 그 밖의 예외 → PERSISTENCE_FAILED ("Failed to store order ...")
 * </pre>
 *
 * <h3>★ 동시 수집</h3>
 * <pre>
 * Thread A: findByExternalId... → 없음 → INSERT 성공 (isNew=true)
 * Thread B: findByExternalId... → 없음 → INSERT 유니크 위반 → 롤백
 * Thread B: findWinner()        → A의 행 (isNew=false)
 * </pre>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrderNormalizer {

    private final ObjectMapper objectMapper;
    private final Validator validator;
    private final OrderWriter orderWriter;
    private final OrderRepository orderRepository;

    /**
     * 원본 주문 하나 수집.
     *
     * @param rawOrder 배치에서 꺼낸 주문 JSON, 그대로 raw payload로 저장된다
     * @return 외부 id, 내부 id, 새로 저장했는지 여부
     * @throws BusinessException 검증 실패 {@code INVALID_ORDER_PAYLOAD}, 저장 실패 {@code PERSISTENCE_FAILED}
     */
    public OrderIngestResult ingest(JsonNode rawOrder) {
        ExternalOrder order = parse(rawOrder);
        String rawPayload = rawOrder.toString();

        try {
            return orderWriter.write(order, rawPayload);
        } catch (DataIntegrityViolationException firstRace) {
            Optional<OrderIngestResult> winner = findWinner(order);
            if (winner.isPresent()) {
                log.info("Order insert race lost, using stored row: externalId={}, id={}",
                        order.id(), winner.get().internalId());
                return winner.get();
            }
            log.warn("Constraint race on related row, retrying once: externalId={}, cause={}",
                    order.id(), firstRace.getMostSpecificCause().getMessage());
            return retry(order, rawPayload);
        } catch (BusinessException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Order write failed: externalId={}", order.id(), e);
            throw new BusinessException(ErrorCode.PERSISTENCE_FAILED,
                    "Failed to store order " + order.id() + ": " + e.getMessage(), e);
        }
    }

    ExternalOrder parse(JsonNode rawOrder) {
        if (rawOrder == null || !rawOrder.isObject()) {
            throw new BusinessException(ErrorCode.INVALID_ORDER_PAYLOAD, "Order payload must be a JSON object");
        }

        ExternalOrder order;
        try {
            order = objectMapper.treeToValue(rawOrder, ExternalOrder.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Unparseable order payload: {}", e.getMessage());
            throw new BusinessException(ErrorCode.INVALID_ORDER_PAYLOAD,
                    "Unparseable order payload: " + e.getMessage(), e);
        }

        Set<ConstraintViolation<ExternalOrder>> violations = validator.validate(order);
        if (!violations.isEmpty()) {
            String detail = violations.stream()
                    .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                    .map(v -> v.getPropertyPath() + " " + v.getMessage())
                    .collect(Collectors.joining(", "));
            log.warn("Rejected order payload: id={}, violations=[{}]", order.id(), detail);
            throw new BusinessException(ErrorCode.INVALID_ORDER_PAYLOAD, "Invalid order payload: " + detail);
        }
        return order;
    }

    private OrderIngestResult retry(ExternalOrder order, String rawPayload) {
        try {
            return orderWriter.write(order, rawPayload);
        } catch (DataIntegrityViolationException secondRace) {
            return findWinner(order).orElseThrow(() -> {
                log.error("Order write failed after retry: externalId={}", order.id(), secondRace);
                return new BusinessException(ErrorCode.PERSISTENCE_FAILED,
                        "Failed to store order " + order.id() + ": "
                                + secondRace.getMostSpecificCause().getMessage(), secondRace);
            });
        }
    }

    private Optional<OrderIngestResult> findWinner(ExternalOrder order) {
        return orderRepository.findByExternalIdAndPosSystemId(order.id(), order.posSystemIdOrDefault())
                .map(Order::getId)
                .map(id -> new OrderIngestResult(order.id(), id, false));
    }
}
