package com.clutch.backend.auth.token.web;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import com.clutch.backend.auth.token.dto.LogoutRequest;
import com.clutch.backend.auth.token.service.RefreshTokenService;

import lombok.RequiredArgsConstructor;

/**
 * POST /auth/logout
 *
 * 멱등: 바디 없음 / 깨진 토큰 / 이미 지워진 세션 => 모두 204
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/auth")
public class AuthLogoutController {

    private final RefreshTokenService refreshTokenService;

    @PostMapping("/logout")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void logout(@RequestBody(required = false) LogoutRequest req) {
        refreshTokenService.logout(req == null ? null : req.refreshToken());
    }
}
