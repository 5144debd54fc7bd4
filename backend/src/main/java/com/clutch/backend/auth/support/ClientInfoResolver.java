package com.clutch.backend.auth.support;

import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

import jakarta.servlet.http.HttpServletRequest;

/**
 * HttpServletRequest -> ClientInfo 추출기 (로그인/리프레시 컨트롤러 공용)
 *
 * IP 우선순위:
 * 1) X-Forwarded-For 의 첫 번째 항목 (프록시 체인의 원 클라이언트)
 * 2) X-Real-IP
 * 3) request.getRemoteAddr()
 * 4) "unknown"
 */
@Component
public class ClientInfoResolver {

    static final String X_FORWARDED_FOR = "X-Forwarded-For";
    static final String X_REAL_IP = "X-Real-IP";
    static final String UNKNOWN_IP = "unknown";

    public ClientInfo resolve(HttpServletRequest request) {
        return new ClientInfo(resolveIp(request), resolveUserAgent(request));
    }

    private String resolveIp(HttpServletRequest request) {
        String forwarded = request.getHeader(X_FORWARDED_FOR);
        if (hasText(forwarded)) {
            String first = forwarded.split(",", 2)[0].trim();
            if (!first.isEmpty()) return first;
        }

        String realIp = request.getHeader(X_REAL_IP);
        if (hasText(realIp)) return realIp.trim();

        String remote = request.getRemoteAddr();
        return hasText(remote) ? remote : UNKNOWN_IP;
    }

    private String resolveUserAgent(HttpServletRequest request) {
        String ua = request.getHeader(HttpHeaders.USER_AGENT);
        return ua == null ? "" : ua;
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}
