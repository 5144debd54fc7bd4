package com.clutch.backend.auth.session.support;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * 신원 인덱스 키 해시
 *
 * - (accountId, ip, userAgent) -> SHA-256 hex (64자)
 * - 구분자는 '\n'. HTTP 헤더 값에는 개행이 들어올 수 없어서
 *   ("a:b", "c") 와 ("a", "b:c") 같은 경계 이동 충돌이 생기지 않는다. (IPv6 주소에는 ':'가 있음)
 */
public final class SessionIdentityHasher {
    private SessionIdentityHasher() {}

    private static final char SEPARATOR = '\n';

    public static String hash(Long accountId, String ipAddress, String userAgent) {
        if (accountId == null) throw new IllegalArgumentException("accountId must not be null");
        if (ipAddress == null) throw new IllegalArgumentException("ipAddress must not be null");
        if (userAgent == null) throw new IllegalArgumentException("userAgent must not be null");

        String material = accountId + String.valueOf(SEPARATOR) + ipAddress + SEPARATOR + userAgent;
        return toHex(sha256(material.getBytes(StandardCharsets.UTF_8)));
    }

    private static byte[] sha256(byte[] input) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(input);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String toHex(byte[] bytes) {
        char[] hex = new char[bytes.length * 2];
        final char[] digits = "0123456789abcdef".toCharArray();

        for (int i = 0; i < bytes.length; i++) {
            int v = bytes[i] & 0xFF;
            hex[i * 2] = digits[v >>> 4];
            hex[i * 2 + 1] = digits[v & 0x0F];
        }
        return new String(hex);
    }
}
