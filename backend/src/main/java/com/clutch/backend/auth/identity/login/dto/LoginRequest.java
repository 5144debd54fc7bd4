package com.clutch.backend.auth.identity.login.dto;

import com.clutch.backend.global.jackson.EmailNormalizingDeserializer;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

/**
 * [로그인 요청 DTO]
 * - 형식 검증(@Email/@NotBlank)만 한다. 계정 존재/비밀번호/활성 여부는 CredentialVerifier 몫.
 */
public record LoginRequest(

        @JsonDeserialize(using = EmailNormalizingDeserializer.class)
        @Email
        @NotBlank
        String email,

        @NotBlank
        String password
) {}
