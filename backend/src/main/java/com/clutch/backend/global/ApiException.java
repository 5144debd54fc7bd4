package com.clutch.backend.global;

import org.springframework.http.HttpStatus;

import lombok.Getter;

/**
 * ErrorCode 기반 단일 런타임 예외.
 *
 * - 인증/세션 코어의 모든 실패(자격 증명, 토큰, 세션 상태, 저장소 장애)를 이 예외 하나로 표현한다.
 * - 호출자는 getErrorCode()로 분기하고, HTTP 변환은 GlobalExceptionHandler / SecurityErrorWriter가 맡는다.
 *
 *   throw new ApiException(ErrorCode.TOKEN_INVALID);
 */
@Getter
public class ApiException extends RuntimeException {

    private final ErrorCode errorCode;
    private final HttpStatus status; // ex: HttpStatus.UNAUTHORIZED
    private final String code;       // ex: "TOKEN_EXPIRED"

    public ApiException(ErrorCode errorCode) {
        this(errorCode, null, null);
    }

    public ApiException(ErrorCode errorCode, String messageOverride) {
        this(errorCode, messageOverride, null);
    }

    // 인프라 예외(Redis 등)를 감쌀 때 원인을 보존한다.
    public ApiException(ErrorCode errorCode, Throwable cause) {
        this(errorCode, null, cause);
    }

    public ApiException(ErrorCode errorCode, String messageOverride, Throwable cause) {
        // super(...)가 첫 줄이어야 해서 null 검사가 뒤에 온다.
        super(resolveMessage(errorCode, messageOverride), cause);

        if (errorCode == null)
            throw new IllegalArgumentException("ErrorCode must not be null");

        this.errorCode = errorCode;
        this.status = errorCode.status();
        this.code = errorCode.name();
    }

    public boolean is(ErrorCode candidate) {
        return errorCode == candidate;
    }

    private static String resolveMessage(ErrorCode errorCode, String messageOverride) {
        if (messageOverride != null && !messageOverride.isBlank()) {
            return messageOverride;
        }
        return (errorCode == null) ? null : errorCode.defaultMessage();
    }
}
