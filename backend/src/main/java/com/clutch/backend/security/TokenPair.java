package com.clutch.backend.security;

/** 로그인/리프레시가 함께 돌려주는 access + refresh 토큰 쌍 */
public record TokenPair(String accessToken, String refreshToken) {}
