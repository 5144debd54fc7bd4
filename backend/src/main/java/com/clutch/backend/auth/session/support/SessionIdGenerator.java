package com.clutch.backend.auth.session.support;

import java.security.SecureRandom;
import java.util.Base64;

import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;

/**
 * 세션 id 생성기
 *
 * - SecureRandom 32바이트 -> Base64 URL-safe(padding 없음), 43자
 * - ':' 가 나오지 않는 문자셋이라 Redis 키("session:{id}")와 인덱스 키("session:user:{hash}")가 겹치지 않는다.
 */
@Component
@RequiredArgsConstructor
public class SessionIdGenerator {

    private static final int ID_BYTES = 32;

    private final SecureRandom secureRandom;

    public String generate() {
        byte[] bytes = new byte[ID_BYTES];
        secureRandom.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
