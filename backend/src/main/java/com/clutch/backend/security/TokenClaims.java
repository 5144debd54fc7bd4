package com.clutch.backend.security;

import java.time.Instant;

/**
 * 검증을 통과한 토큰의 클레임 셋.
 *
 * - accountId: sub
 * - admin: admin 클레임
 * - sessionId: session_id 클레임 (없을 수 있음)
 * - kind: type 클레임
 * - issuedAt / expiresAt: iat / exp (초 단위)
 */
public record TokenClaims(
        Long accountId,
        boolean admin,
        String sessionId,
        TokenKind kind,
        Instant issuedAt,
        Instant expiresAt
) {
    public boolean hasSessionId() {
        return sessionId != null && !sessionId.isBlank();
    }
}
