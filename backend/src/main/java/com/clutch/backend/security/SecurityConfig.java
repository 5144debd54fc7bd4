package com.clutch.backend.security;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

import lombok.RequiredArgsConstructor;

/**
 * Spring Security 전역 설정
 *
 * - Bearer 인증: JwtAuthenticationFilter
 * - 인증 없이 보호 리소스 접근: RestAuthEntryPoint (AUTH_REQUIRED)
 * - 토큰은 있는데 invalid/expired: JwtAuthenticationFilter (TOKEN_INVALID / TOKEN_EXPIRED)
 * - 서버 측 "세션"은 Redis 세션 저장소가 관리하므로 HttpSession은 쓰지 않는다. (STATELESS)
 */
@Configuration
@RequiredArgsConstructor
public class SecurityConfig {

    private final AccessTokenVerifier accessTokenVerifier;
    private final SecurityErrorWriter securityErrorWriter;

    @Bean
    RestAuthEntryPoint restAuthEntryPoint() {
        return new RestAuthEntryPoint(securityErrorWriter);
    }

    @Bean
    JwtAuthenticationFilter jwtAuthenticationFilter() {
        return new JwtAuthenticationFilter(accessTokenVerifier, securityErrorWriter);
    }

    @Bean
    SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        return http
                .csrf(csrf -> csrf.disable()) // 쿠키 인증을 쓰지 않는 REST API
                .httpBasic(b -> b.disable())
                .formLogin(f -> f.disable())
                .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .exceptionHandling(eh -> eh.authenticationEntryPoint(restAuthEntryPoint()))
                .addFilterBefore(
                        jwtAuthenticationFilter(),
                        UsernamePasswordAuthenticationFilter.class
                )
                .authorizeHttpRequests(auth -> auth
                        .requestMatchers("/error").permitAll()
                        .requestMatchers("/actuator/health/**").permitAll()

                        // 인증 필요 없는 Auth 엔드포인트
                        .requestMatchers("/auth/login").permitAll()
                        .requestMatchers("/auth/refresh").permitAll()
                        .requestMatchers("/auth/logout").permitAll()
                        .requestMatchers("/auth/status").permitAll()

                        // 그 외는 인증 필요 (/auth/me 포함)
                        .anyRequest().authenticated()
                )
                .build();
    }
}
