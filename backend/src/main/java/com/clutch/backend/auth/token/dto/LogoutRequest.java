package com.clutch.backend.auth.token.dto;

/**
 * 로그아웃 요청 바디
 * - refreshToken이 없어도 204 (멱등)이라 검증 어노테이션을 두지 않는다.
 */
public record LogoutRequest(String refreshToken) {}
