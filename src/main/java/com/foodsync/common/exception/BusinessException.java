package com.foodsync.common.exception;

import lombok.Getter;

/**
 * 비즈니스 예외 (Business Exception)
 *
 * <p>잘못된 입력, 원격 조회 실패, 작업 단위 실패를 나타내는 unchecked 예외.
 * ErrorCode가 HTTP 상태를 정하고, 메시지에는 원인 텍스트를 그대로 남긴다.</p>
 *
 * <h3>사용 예시</h3>
 * <pre>
 *   // 기본 메시지
 *   throw new BusinessException(ErrorCode.ORDER_NOT_FOUND);
 *
 *   // 원인을 담은 상세 메시지
 *   throw new BusinessException(ErrorCode.REMOTE_FETCH_FAILED, "Error fetching menu: 503");
 * </pre>
 */
@Getter
public class BusinessException extends RuntimeException {

    /** 에러 코드 (HTTP 상태 + 기본 메시지) */
    private final ErrorCode errorCode;

    public BusinessException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
