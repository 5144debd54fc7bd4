package com.clutch.backend.auth.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 최초 관리자 계정 시드 설정 (app.bootstrap.admin.*)
 *
 * - 셋 다 채워져 있을 때만 AdminAccountInitializer가 동작한다.
 * - password는 운영에서 환경변수로만 주입한다.
 */
@ConfigurationProperties(prefix = "app.bootstrap.admin")
public record AdminBootstrapProperties(String email, String name, String password) {

    public boolean isConfigured() {
        return hasText(email) && hasText(name) && hasText(password);
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}
