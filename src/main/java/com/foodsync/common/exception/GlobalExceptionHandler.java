package com.foodsync.common.exception;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.net.URI;

/**
 * 전역 예외 처리기 (Global Exception Handler)
 *
 * <p>예외를 RFC 7807 {@link ProblemDetail} 응답으로 변환한다.</p>
 *
 * <h3>처리하는 예외 유형</h3>
 * <ol>
 *   <li><b>BusinessException</b>: ErrorCode의 상태 코드와 상세 메시지</li>
 *   <li><b>CallNotPermittedException</b>: 플랫폼 클라이언트의 Circuit Breaker OPEN</li>
 *   <li><b>HttpMessageNotReadableException</b>: JSON으로 읽을 수 없는 요청 본문</li>
 * </ol>
 *
 * <p>응답 예시:</p>
 * <pre>
 *   {
 *     "type": "https://foodsync.dev/errors/remote_fetch_failed",
 *     "status": 502,
 *     "detail": "Error fetching menu: 503 Service Unavailable"
 *   }
 * </pre>
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final String ERROR_TYPE_BASE = "https://foodsync.dev/errors/";

    /**
     * 비즈니스 예외 처리. 5xx 코드만 error 레벨로 남긴다 (4xx는 호출 측에서 이미 warn 기록).
     */
    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ProblemDetail> handleBusinessException(BusinessException e) {
        ErrorCode errorCode = e.getErrorCode();
        if (errorCode.getStatus().is5xxServerError()) {
            log.error("Request failed: code={}, detail={}", errorCode, e.getMessage());
        }
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(
                errorCode.getStatus(), e.getMessage());
        // type URI: 에러 코드명을 소문자로
        problem.setType(URI.create(ERROR_TYPE_BASE + errorCode.name().toLowerCase()));
        return ResponseEntity.status(errorCode.getStatus()).body(problem);
    }

    // ★ 플랫폼 클라이언트 Circuit Breaker OPEN → 원격 호출 없이 즉시 503
    @ExceptionHandler(CallNotPermittedException.class)
    public ResponseEntity<ProblemDetail> handleCircuitBreakerOpen(CallNotPermittedException e) {
        log.warn("Circuit breaker open: {}", e.getMessage());
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(
                HttpStatus.SERVICE_UNAVAILABLE, ErrorCode.SERVICE_UNAVAILABLE.getMessage());
        problem.setType(URI.create(ERROR_TYPE_BASE + "service_unavailable"));
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(problem);
    }

    // 요청 본문이 JSON이 아님
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ProblemDetail> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMostSpecificCause().getMessage());
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(
                HttpStatus.BAD_REQUEST, ErrorCode.INVALID_INPUT.getMessage());
        problem.setType(URI.create(ERROR_TYPE_BASE + "invalid_input"));
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(problem);
    }
}
