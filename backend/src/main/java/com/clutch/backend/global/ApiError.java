package com.clutch.backend.global;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 공통 API 에러 응답 DTO
 *
 * - ControllerAdvice / EntryPoint / Filter 어디서 실패하든 같은 JSON 스키마로 내려간다.
 * - code: 클라이언트 분기용 안정 식별자 (ErrorCode.name())
 * - message: 사용자 메시지. 내부 실패 사유(어떤 검증이 깨졌는지)는 싣지 않는다.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiError(
        String code,    // ex: "TOKEN_INVALID"
        String message  // ex: "토큰이 유효하지 않습니다."
) {
    public static ApiError of(ErrorCode errorCode) {
        return new ApiError(errorCode.name(), errorCode.defaultMessage());
    }

    public static ApiError of(ErrorCode errorCode, String messageOverride) {
        return new ApiError(errorCode.name(), messageOverride);
    }

    public static ApiError from(ApiException e) {
        return new ApiError(e.getCode(), e.getMessage());
    }
}
