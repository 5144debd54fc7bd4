package com.clutch.backend.security;

import java.io.IOException;

import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;

import com.clutch.backend.global.ErrorCode;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;

/**
 * 보호 리소스에 인증 없이(Authorization 헤더 자체가 없음) 접근했을 때 -> 401 AUTH_REQUIRED
 * 헤더는 있는데 토큰이 깨진 경우는 JwtAuthenticationFilter가 먼저 응답한다.
 */
@RequiredArgsConstructor
public class RestAuthEntryPoint implements AuthenticationEntryPoint {

    private final SecurityErrorWriter errorWriter;

    @Override
    public void commence(
            HttpServletRequest request,
            HttpServletResponse response,
            AuthenticationException authException) throws IOException {

        errorWriter.write(response, ErrorCode.AUTH_REQUIRED);
    }
}
