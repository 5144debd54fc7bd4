package com.clutch.backend.auth.support;

/**
 * 세션 바인딩에 쓰이는 클라이언트 정보.
 *
 * @param ip        클라이언트 IP (X-Forwarded-For 첫 항목 / X-Real-IP / remoteAddr / "unknown")
 * @param userAgent User-Agent 헤더 원문 (없으면 "")
 */
public record ClientInfo(String ip, String userAgent) {

    public ClientInfo {
        if (ip == null) throw new IllegalArgumentException("ip must not be null");
        if (userAgent == null) throw new IllegalArgumentException("userAgent must not be null");
    }
}
