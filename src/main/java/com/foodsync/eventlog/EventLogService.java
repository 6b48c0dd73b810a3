package com.foodsync.eventlog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.foodsync.common.exception.BusinessException;
import com.foodsync.common.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * 이벤트 로그 서비스 - 수집 배치와 메뉴 동기화의 감사 기록.
 *
 * <p>배치 하나, 동기화 한 번마다 {@code webhook_logs}에 한 행을 남긴다.</p>
 *
 * <h3>★ REQUIRES_NEW</h3>
 * <p>{@link #record}는 별도 트랜잭션에서 실행된다.
 * 실패한 작업 단위가 롤백되어도 그 실패를 기록한 error 이벤트는 남는다.</p>
 * <pre>
 *   @Transactional
 *   sync() {
 *       rebuild();                       // 예외 발생 → 롤백 대상
 *       eventLogService.error(...);      // REQUIRES_NEW → 먼저 커밋됨
 *   }
 * </pre>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EventLogService {

    static final int MAX_LIMIT = 500; // 한 페이지 최대 행 수

    private final WebhookLogRepository webhookLogRepository;
    private final ObjectMapper objectMapper;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void record(EventType eventType, Object payload, EventStatus status, String errorMessage) {
        WebhookLog entry = WebhookLog.builder()
                .eventType(eventType)
                .payload(serialize(payload))
                .status(status)
                .errorMessage(errorMessage)
                .build();
        webhookLogRepository.save(entry);
        log.debug("Event recorded: type={}, status={}", eventType.getCode(), status.getCode());
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void success(EventType eventType, Object payload) {
        record(eventType, payload, EventStatus.SUCCESS, null);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void error(EventType eventType, Object payload, String errorMessage) {
        record(eventType, payload, EventStatus.ERROR, errorMessage);
    }

    /**
     * 최신순 이벤트 조회.
     *
     * @param eventType 비어 있으면 전체 유형
     * @param page      1부터 시작, 1 미만이면 첫 페이지
     * @param limit     1 이상, {@value #MAX_LIMIT}에서 잘림
     * @throws BusinessException limit이 1 미만이면 {@code INVALID_INPUT}
     */
    @Transactional(readOnly = true)
    public List<WebhookLog> getLogs(String eventType, int page, int limit) {
        if (limit < 1) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "limit must be at least 1");
        }
        PageRequest pageRequest = PageRequest.of(Math.max(page - 1, 0), Math.min(limit, MAX_LIMIT));
        if (eventType == null || eventType.isBlank()) {
            return webhookLogRepository.findAllByOrderByCreatedAtDescIdDesc(pageRequest);
        }
        return webhookLogRepository.findByEventTypeOrderByCreatedAtDescIdDesc(eventType, pageRequest);
    }

    private String serialize(Object payload) {
        if (payload == null || payload instanceof String) {
            return (String) payload;
        }
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            // 직렬화 실패해도 이벤트 자체는 남긴다
            log.warn("Event payload not serializable, storing toString(): {}", e.getOriginalMessage());
            return String.valueOf(payload);
        }
    }
}
