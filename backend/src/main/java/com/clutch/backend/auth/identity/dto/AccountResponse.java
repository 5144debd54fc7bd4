package com.clutch.backend.auth.identity.dto;

import java.time.Instant;
import java.util.Objects;

import com.clutch.backend.auth.domain.Account;

/**
 * 계정 요약 응답 (로그인 / me / status 공용)
 * - password_hash는 어떤 경로로도 내려가지 않는다.
 */
public record AccountResponse(
        Long id,
        String email,
        String name,
        boolean admin,
        boolean active,
        Instant createdAt
) {
    public static AccountResponse from(Account account) {
        Objects.requireNonNull(account, "account must not be null");

        return new AccountResponse(
                account.getId(),
                account.getEmail(),
                account.getName(),
                account.isAdmin(),
                account.isActive(),
                account.getCreatedAt()
        );
    }
}
