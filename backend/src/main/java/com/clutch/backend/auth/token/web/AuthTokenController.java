package com.clutch.backend.auth.token.web;

import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.clutch.backend.auth.support.ClientInfoResolver;
import com.clutch.backend.auth.token.dto.RefreshRequest;
import com.clutch.backend.auth.token.dto.RefreshResponse;
import com.clutch.backend.auth.token.service.RefreshTokenService;
import com.clutch.backend.auth.token.service.RefreshTokenService.RefreshResult;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

/**
 * POST /auth/refresh
 *
 * 바디의 refreshToken + 요청 IP/User-Agent로 로테이션한다.
 * 실패는 서비스가 던지는 TOKEN_EXPIRED / TOKEN_INVALID (/ SESSION_STORE_UNAVAILABLE).
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/auth")
public class AuthTokenController {

    private final RefreshTokenService refreshTokenService;
    private final ClientInfoResolver clientInfoResolver;

    @PostMapping("/refresh")
    public RefreshResponse refresh(@Valid @RequestBody RefreshRequest req, HttpServletRequest request) {
        RefreshResult result = refreshTokenService.refresh(req.refreshToken(), clientInfoResolver.resolve(request));
        return RefreshResponse.of(result.tokens().accessToken(), result.tokens().refreshToken());
    }
}
