package com.foodsync.common.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 공통 API 응답 래퍼 (Common API Response Wrapper)
 *
 * <p>모든 엔드포인트가 success/data/message 형식으로 응답한다.
 * 에러 응답은 {@code GlobalExceptionHandler}의 ProblemDetail을 쓰고,
 * 이 래퍼는 정상 처리 결과와 일부 실패한 배치 결과를 담는다.</p>
 *
 * <h3>사용 예시</h3>
 * <pre>
 *   // 성공: {"success": true, "data": {...}}
 *   return ApiResponse.ok(orderDto);
 *
 *   // 배치 일부 실패: {"success": false, "data": {...}, "message": "1 of 3 orders failed"}
 *   return ApiResponse.failure(batchResult, message);
 * </pre>
 *
 * @param <T> 응답 데이터의 타입
 */
@JsonInclude(JsonInclude.Include.NON_NULL) // null 필드는 JSON에서 제외
public record ApiResponse<T>(
        boolean success, // 요청 성공 여부
        T data,          // 응답 데이터
        String message   // 부가 메시지 (실패 요약 등)
) {
    /** 성공 응답 팩토리 메서드 */
    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(true, data, null);
    }

    public static <T> ApiResponse<T> ok(T data, String message) {
        return new ApiResponse<>(true, data, message);
    }

    public static <T> ApiResponse<T> failure(T data, String message) {
        return new ApiResponse<>(false, data, message);
    }
}
