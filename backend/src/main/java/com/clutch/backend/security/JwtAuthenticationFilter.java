package com.clutch.backend.security;

import java.io.IOException;
import java.util.List;
import java.util.Set;

import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.web.filter.OncePerRequestFilter;

import com.clutch.backend.auth.domain.Account;
import com.clutch.backend.global.ApiException;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;

/**
 * Bearer Access Token 인증 필터
 *
 * 정책:
 * - 토큰이 "없으면" 통과한다. (차단은 SecurityConfig 인가 규칙 + EntryPoint 담당)
 * - 토큰이 "있는데" 검증 실패면 여기서 401(TOKEN_EXPIRED / TOKEN_INVALID)로 끝낸다.
 * - OPTIONAL_AUTH_PATHS 는 컨트롤러가 AccessTokenVerifier.verifyOptional 로 직접 판단하므로 건너뛴다.
 */
@RequiredArgsConstructor
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    static final Set<String> OPTIONAL_AUTH_PATHS = Set.of("/auth/status");

    private final AccessTokenVerifier accessTokenVerifier;
    private final SecurityErrorWriter errorWriter;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return OPTIONAL_AUTH_PATHS.contains(request.getServletPath());
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {

        // 이미 인증이 만들어진 요청이면 중복 처리하지 않는다.
        if (SecurityContextHolder.getContext().getAuthentication() != null) {
            filterChain.doFilter(request, response);
            return;
        }

        String token = BearerTokenResolver.resolve(request);
        if (token == null) {
            filterChain.doFilter(request, response);
            return;
        }

        Account account;
        try {
            // 서명/만료/issuer/type=access + 계정 활성 여부
            account = accessTokenVerifier.verify(token);
        } catch (ApiException ex) {
            SecurityContextHolder.clearContext();
            errorWriter.write(response, ex.getErrorCode());
            return;
        }

        AuthPrincipal principal = AuthPrincipal.from(account);
        var authentication = new UsernamePasswordAuthenticationToken(
                principal,
                null,
                List.of(new SimpleGrantedAuthority(principal.authority()))
        );
        authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
        SecurityContextHolder.getContext().setAuthentication(authentication);

        filterChain.doFilter(request, response);
    }
}
