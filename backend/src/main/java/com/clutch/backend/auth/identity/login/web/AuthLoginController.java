package com.clutch.backend.auth.identity.login.web;

import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.clutch.backend.auth.identity.dto.AccountResponse;
import com.clutch.backend.auth.identity.login.dto.LoginRequest;
import com.clutch.backend.auth.identity.login.dto.LoginResponse;
import com.clutch.backend.auth.identity.login.service.LoginService;
import com.clutch.backend.auth.identity.login.service.LoginService.LoginResult;
import com.clutch.backend.auth.support.ClientInfoResolver;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

/**
 * 로그인 API
 * - 요청 IP / User-Agent를 세션 바인딩 값으로 넘긴다.
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/auth")
public class AuthLoginController {

    private final LoginService loginService;
    private final ClientInfoResolver clientInfoResolver;

    @PostMapping("/login")
    public LoginResponse login(@Valid @RequestBody LoginRequest req, HttpServletRequest request) {

        LoginResult result = loginService.login(
                req.email(),
                req.password(),
                clientInfoResolver.resolve(request)
        );

        return LoginResponse.of(
                result.tokens().accessToken(),
                result.tokens().refreshToken(),
                AccountResponse.from(result.account())
        );
    }
}
