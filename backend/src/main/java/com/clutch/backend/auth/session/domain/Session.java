package com.clutch.backend.auth.session.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * 서버 측 세션 레코드 (refresh token 1개 = 세션 1개)
 *
 * - id: 저장소가 create/rotate 때 발급. 저장 전에는 null.
 * - (accountId, ipAddress, userAgent) 트리플에 묶인다. 다른 IP/UA에서 온 refresh는 거부된다.
 * - expiresAt은 쓰기 시점에 항상 미래여야 한다. 지난 세션은 어떤 조회 경로에서도 "없음"이다.
 */
public record Session(
        String id,
        Long accountId,
        String ipAddress,
        String userAgent,
        Instant createdAt,
        Instant updatedAt,
        Instant expiresAt
) {

    public Session {
        Objects.requireNonNull(accountId, "accountId must not be null");
        Objects.requireNonNull(ipAddress, "ipAddress must not be null");
        Objects.requireNonNull(userAgent, "userAgent must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        Objects.requireNonNull(updatedAt, "updatedAt must not be null");
        Objects.requireNonNull(expiresAt, "expiresAt must not be null");
    }

    /** 아직 저장되지 않은(id 없는) 새 세션 */
    public static Session open(Long accountId, String ipAddress, String userAgent, Instant now, Instant expiresAt) {
        return new Session(null, accountId, ipAddress, userAgent, now, now, expiresAt);
    }

    public Session withId(String newId) {
        return new Session(newId, accountId, ipAddress, userAgent, createdAt, updatedAt, expiresAt);
    }

    public Session withUpdatedAt(Instant at) {
        return new Session(id, accountId, ipAddress, userAgent, createdAt, at, expiresAt);
    }

    public Session withExpiresAt(Instant at) {
        return new Session(id, accountId, ipAddress, userAgent, createdAt, updatedAt, at);
    }

    /** 저장소 관점의 만료: expiresAt <= now 이면 없는 세션으로 본다. */
    public boolean isExpiredAt(Instant now) {
        return !expiresAt.isAfter(now);
    }
}
