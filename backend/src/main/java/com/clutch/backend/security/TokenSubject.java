package com.clutch.backend.security;

import com.clutch.backend.auth.domain.Account;

/**
 * 토큰에 실을 주체 정보 (발급 입력값).
 * sessionId는 세션에 묶이지 않는 토큰이면 null.
 */
public record TokenSubject(Long accountId, boolean admin, String sessionId) {

    public TokenSubject {
        if (accountId == null) throw new IllegalArgumentException("accountId must not be null");
    }

    public static TokenSubject of(Account account, String sessionId) {
        return new TokenSubject(account.getId(), account.isAdmin(), sessionId);
    }
}
