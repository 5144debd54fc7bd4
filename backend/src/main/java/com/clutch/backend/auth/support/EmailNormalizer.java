package com.clutch.backend.auth.support;

import java.util.Locale;

/**
 * 이메일 정규화 규칙: 앞뒤 공백 제거 + 소문자.
 * 요청 역직렬화, 로그인 조회, 관리자 시드가 같은 규칙을 써야 조회가 어긋나지 않는다.
 */
public final class EmailNormalizer {
    private EmailNormalizer() {}

    public static String normalize(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("email must not be null");
        }
        return raw.trim().toLowerCase(Locale.ROOT);
    }
}
