package com.clutch.backend.auth.session.store;

import java.time.Duration;
import java.time.Instant;

import com.clutch.backend.global.ApiException;
import com.clutch.backend.global.ErrorCode;

/** 저장 TTL = expiresAt - now. 0 이하면 SESSION_INVALID_STATE. */
final class SessionTtls {
    private SessionTtls() {}

    static Duration remaining(Instant expiresAt, Instant now) {
        Duration ttl = Duration.between(now, expiresAt);
        if (ttl.isZero() || ttl.isNegative()) {
            throw new ApiException(ErrorCode.SESSION_INVALID_STATE);
        }
        return ttl;
    }
}
