package com.clutch.backend.security;

import com.clutch.backend.auth.domain.Account;

/**
 * SecurityContext에 저장되는 "인증된 계정"의 최소 정보(Principal).
 * - JwtAuthenticationFilter가 access 검증 성공 시 만든다.
 */
public record AuthPrincipal(Long accountId, boolean admin) {

    public AuthPrincipal {
        if (accountId == null) throw new IllegalArgumentException("accountId must not be null");
    }

    public static AuthPrincipal from(Account account) {
        return new AuthPrincipal(account.getId(), account.isAdmin());
    }

    /** Spring Security 권한 문자열 규칙(ROLE_*) */
    public String authority() {
        return admin ? "ROLE_ADMIN" : "ROLE_USER";
    }
}
