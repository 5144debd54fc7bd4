package com.clutch.backend.auth.identity.status.web;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.clutch.backend.auth.identity.dto.AccountResponse;
import com.clutch.backend.auth.identity.status.dto.AuthStatusResponse;
import com.clutch.backend.security.AccessTokenVerifier;
import com.clutch.backend.security.BearerTokenResolver;

import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;

/**
 * GET /auth/status
 *
 * 선택적 인증: 토큰이 없거나 만료/무효여도 401이 아니라 authenticated=false 로 200을 준다.
 * (JwtAuthenticationFilter는 이 경로를 건너뛴다)
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/auth")
public class AuthStatusController {

    private final AccessTokenVerifier accessTokenVerifier;

    @GetMapping("/status")
    public AuthStatusResponse status(HttpServletRequest request) {
        return accessTokenVerifier.verifyOptional(BearerTokenResolver.resolve(request))
                .map(AccountResponse::from)
                .map(AuthStatusResponse::of)
                .orElseGet(AuthStatusResponse::anonymous);
    }
}
