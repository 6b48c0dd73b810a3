package com.foodsync.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * 에러 코드 열거형 (Error Code Enum)
 *
 * <p>수집 파이프라인과 조회 API가 함께 쓰는 에러 코드.
 * 각 코드는 {@link GlobalExceptionHandler}가 쓸 HTTP 상태와 기본 메시지를 가진다.</p>
 *
 * <h3>에러 코드 분류</h3>
 * <ul>
 *   <li><b>Common</b>: 입력값 오류, 인증 실패, 서킷 브레이커 차단</li>
 *   <li><b>Ingestion</b>: 주문/메뉴 수집 중 실패 (검증, 원격 조회, 저장, 기한 초과)</li>
 *   <li><b>Reads</b>: 조회 대상 없음</li>
 * </ul>
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // ── Common (공통 에러) ──
    INVALID_INPUT(HttpStatus.BAD_REQUEST, "Invalid input value"),
    UNAUTHORIZED(HttpStatus.UNAUTHORIZED, "Unauthorized"),
    SERVICE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "Service temporarily unavailable"),

    // ── Ingestion (수집 파이프라인) ──
    // 푸시 웹훅의 마스터 키 불일치
    UNAUTHORIZED_WEBHOOK(HttpStatus.UNAUTHORIZED, "Invalid master key"),
    INVALID_ORDER_PAYLOAD(HttpStatus.BAD_REQUEST, "Invalid order payload"),
    INVALID_MENU_SNAPSHOT(HttpStatus.BAD_REQUEST, "Invalid menu snapshot"),
    REMOTE_FETCH_FAILED(HttpStatus.BAD_GATEWAY, "Remote fetch failed"),
    PERSISTENCE_FAILED(HttpStatus.INTERNAL_SERVER_ERROR, "Persistence failed"),
    // 메뉴 재구성이 rebuild-timeout을 넘김 → 롤백
    SYNC_TIMEOUT(HttpStatus.GATEWAY_TIMEOUT, "Menu sync exceeded its deadline"),

    // ── Reads (조회) ──
    ORDER_NOT_FOUND(HttpStatus.NOT_FOUND, "Order not found"),
    MENU_NOT_FOUND(HttpStatus.NOT_FOUND, "Menu not found. Please sync first with POST /api/menu/sync");

    private final HttpStatus status;   // HTTP 응답 상태 코드
    private final String message;      // 기본 에러 메시지
}
