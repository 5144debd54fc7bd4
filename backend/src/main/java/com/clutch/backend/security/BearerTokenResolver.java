package com.clutch.backend.security;

import org.springframework.http.HttpHeaders;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Authorization: Bearer <token> 에서 <token>만 꺼낸다.
 * - 헤더 없음 / Bearer 아님 / 토큰 공백 -> null
 */
public final class BearerTokenResolver {
    private BearerTokenResolver() {}

    private static final String BEARER_PREFIX = "Bearer ";

    public static String resolve(HttpServletRequest request) {
        String authHeader = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authHeader == null || authHeader.isBlank()) return null;
        if (!authHeader.startsWith(BEARER_PREFIX)) return null;

        String token = authHeader.substring(BEARER_PREFIX.length()).trim();
        return token.isBlank() ? null : token;
    }
}
