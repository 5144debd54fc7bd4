package com.clutch.backend.auth.config;

import java.security.SecureRandom;
import java.time.Clock;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

/**
 * 인증 모듈 공통 Bean
 *
 * @EnableConfigurationProperties
 *  - AuthProperties, AdminBootstrapProperties 바인딩 + 검증 활성화
 */
@Configuration
@EnableConfigurationProperties({
        AuthProperties.class,
        AdminBootstrapProperties.class
})
public class AuthModuleConfig {

    /**
     * 토큰 iat/exp, 세션 expiresAt 모두 이 Clock 하나로 계산한다. (UTC)
     * - 테스트에서는 TestClockConfig의 MutableClock이 대신 들어간다.
     */
    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SecureRandom secureRandom() {
        return new SecureRandom();
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }
}
