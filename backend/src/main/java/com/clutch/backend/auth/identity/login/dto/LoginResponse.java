package com.clutch.backend.auth.identity.login.dto;

import com.clutch.backend.auth.identity.dto.AccountResponse;

/**
 * 로그인 응답 DTO
 * - accessToken: Authorization: Bearer {accessToken} 로 사용
 * - refreshToken: POST /auth/refresh, /auth/logout 바디로 사용 (1회용)
 */
public record LoginResponse(
        String accessToken,
        String refreshToken,
        String tokenType,
        AccountResponse account
) {
    public static LoginResponse of(String accessToken, String refreshToken, AccountResponse account) {
        return new LoginResponse(accessToken, refreshToken, "Bearer", account);
    }
}
