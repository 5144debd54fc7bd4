package com.clutch.backend.security;

/**
 * 토큰 종류. JWT "type" 클레임 값으로 들어간다.
 * - access 자리에 refresh를, refresh 자리에 access를 내밀면 TOKEN_INVALID.
 */
public enum TokenKind {
    ACCESS("access"),
    REFRESH("refresh");

    private final String claimValue;

    TokenKind(String claimValue) {
        this.claimValue = claimValue;
    }

    public String claimValue() {
        return claimValue;
    }

    /** 알 수 없는 값이면 null */
    public static TokenKind fromClaim(String raw) {
        for (TokenKind kind : values()) {
            if (kind.claimValue.equals(raw)) return kind;
        }
        return null;
    }
}
