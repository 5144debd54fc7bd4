package com.clutch.backend.auth.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/*
  @ConfigurationProperties(prefix = "app.auth"):
  application.yml 의 app.auth.* 값을 타입 안전하게 바인딩한다. 규칙 위반 시 부팅 실패.

  app:
    auth:
      jwt:
        issuer: clutch-backend
        algorithm: HS256
        secret: ${APP_AUTH_JWT_SECRET}
        access-ttl-seconds: 300
        refresh-ttl-seconds: 604800
        clock-skew-seconds: 0
      session:
        ttl-seconds: 604800
        key-prefix: "auth:session:"
        store: redis
        cleanup-interval: PT5M
 */
@Validated
@ConfigurationProperties(prefix = "app.auth")
public record AuthProperties(@Valid @NotNull Jwt jwt,
                             @Valid @NotNull Session session) {

    /**
     * JWT 관련 설정
     * - issuer: 토큰 발급자 식별자 (검증 시 requireIssuer)
     * - algorithm: HMAC 서명 알고리즘 (HS256/HS384/HS512)
     * - secret: 서명 비밀키. 알고리즘별 최소 길이는 JwtService가 한 번 더 본다.
     * - clockSkewSeconds: exp 검증 시 허용하는 시계 오차
     */
    public record Jwt(
            @NotBlank String issuer,

            @NotBlank @Pattern(regexp = "HS256|HS384|HS512", message = "algorithm must be HS256, HS384 or HS512")
            String algorithm,

            @NotBlank @Size(min = 32) String secret,

            @Min(1) long accessTtlSeconds,

            @Min(1) long refreshTtlSeconds,

            @Min(0) long clockSkewSeconds
    ) {}

    /**
     * 서버 측 세션 설정
     * - ttlSeconds: 로그인/리프레시 때마다 expiresAt = now + ttlSeconds 로 갱신
     * - keyPrefix: Redis 키 prefix ("auth:session:" -> auth:session:{id}, auth:session:user:{hash})
     * - store: 세션 저장소 구현 선택
     * - cleanupInterval: 만료 세션 정리 주기 (TTL 없는 저장소용)
     */
    public record Session(
            @Min(1) long ttlSeconds,

            @NotBlank String keyPrefix,

            @NotNull StoreType store,

            @NotNull Duration cleanupInterval
    ) {}

    public enum StoreType {
        REDIS, MEMORY
    }
}
