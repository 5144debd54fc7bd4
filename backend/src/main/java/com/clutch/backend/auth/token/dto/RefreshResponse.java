package com.clutch.backend.auth.token.dto;

/**
 * /auth/refresh 응답 바디
 * - 새 refreshToken을 받은 순간 이전 refreshToken은 더 이상 쓸 수 없다.
 */
public record RefreshResponse(String accessToken, String refreshToken, String tokenType) {

    public static RefreshResponse of(String accessToken, String refreshToken) {
        return new RefreshResponse(accessToken, refreshToken, "Bearer");
    }
}
