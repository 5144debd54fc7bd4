package com.clutch.backend.global;

import org.springframework.http.HttpStatus;

/**
 * 에러 코드(클라이언트 분기용) + HTTP 상태 + 기본 메시지의 단일 소스.
 *
 * 원칙:
 * - code = enum name() (변경 시 API 계약 깨짐)
 * - 토큰 실패는 TOKEN_EXPIRED / TOKEN_INVALID 두 가지만 밖으로 나간다.
 *   세션 없음, 바인딩 불일치, 재사용 등 세부 사유는 로그에만 남긴다.
 */
public enum ErrorCode {

    // Login
    INVALID_CREDENTIALS(HttpStatus.UNAUTHORIZED,
            "이메일 또는 비밀번호가 올바르지 않습니다."),

    // Token
    TOKEN_EXPIRED(HttpStatus.UNAUTHORIZED,
            "토큰이 만료되었습니다."),
    TOKEN_INVALID(HttpStatus.UNAUTHORIZED,
            "토큰이 유효하지 않습니다."),

    // Auth / Security
    AUTH_REQUIRED(HttpStatus.UNAUTHORIZED,
            "인증이 필요합니다."),

    // Session store
    SESSION_NOT_FOUND(HttpStatus.NOT_FOUND,
            "세션을 찾을 수 없습니다."),
    SESSION_INVALID_STATE(HttpStatus.INTERNAL_SERVER_ERROR,
            "세션 만료 시각이 올바르지 않습니다."),
    SESSION_STORE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE,
            "일시적으로 요청을 처리할 수 없습니다. 잠시 후 다시 시도해주세요."),

    // Validation / Common
    VALIDATION_ERROR(HttpStatus.BAD_REQUEST,
            "요청 값이 올바르지 않습니다."),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR,
            "서버 오류가 발생했습니다.");

    private final HttpStatus status;
    private final String defaultMessage;

    ErrorCode(HttpStatus status, String defaultMessage) {
        this.status = status;
        this.defaultMessage = defaultMessage;
    }

    public HttpStatus status() {
        return status;
    }

    public String defaultMessage() {
        return defaultMessage;
    }
}
