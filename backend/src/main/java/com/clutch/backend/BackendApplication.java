package com.clutch.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;
import org.springframework.context.annotation.Import;

import com.clutch.backend.auth.config.AuthModuleConfig;

/*
================================================================================
[curl 시나리오]  (login -> me -> refresh -> logout)
================================================================================
# 로그인 200
curl -i -X POST "http://localhost:8080/auth/login" \
  -H "Content-Type: application/json" \
  -H "User-Agent: curl-demo" \
  -d '{"email":"admin@clutch.dev","password":"change-me-please"}'
- 바디에 accessToken / refreshToken 둘 다 내려온다.
- 같은 계정 + 같은 IP + 같은 UA로 다시 로그인하면 세션은 새로 안 만들고 만료만 연장

# /auth/me 200
curl -i "http://localhost:8080/auth/me" -H "Authorization: Bearer <accessToken>"

# refresh 200 (같은 UA로 보내야 함. 다르면 401 TOKEN_INVALID)
curl -i -X POST "http://localhost:8080/auth/refresh" \
  -H "Content-Type: application/json" \
  -H "User-Agent: curl-demo" \
  -d '{"refreshToken":"<refreshToken>"}'
- 응답의 새 refreshToken만 유효. 방금 보낸 건 다시 쓰면 401

# 로그아웃 204 (몇 번을 보내도 204)
curl -i -X POST "http://localhost:8080/auth/logout" \
  -H "Content-Type: application/json" \
  -d '{"refreshToken":"<refreshToken>"}'

================================================================================
[Redis 확인]
================================================================================
redis-cli --scan --pattern 'auth:session:*'
redis-cli ttl auth:session:<sessionId>
*/

/**
 * 설정 값 주입 흐름:
 *    환경변수 -> application.yml(${ENV:default}) -> @ConfigurationProperties(AuthProperties, AdminBootstrapProperties)
 *
 * - APP_AUTH_JWT_SECRET은 기본값이 없다. 없거나 32바이트 미만이면 부팅 실패.
 * - UserDetailsService 자동설정은 끈다. (JWT만 쓰므로 기본 인메모리 유저 불필요)
 */
@Import(AuthModuleConfig.class)
@SpringBootApplication(exclude = {UserDetailsServiceAutoConfiguration.class})
public class BackendApplication {
    public static void main(String[] args) {
        SpringApplication.run(BackendApplication.class, args);
    }
}
