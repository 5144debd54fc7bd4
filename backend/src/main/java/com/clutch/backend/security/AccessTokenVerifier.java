package com.clutch.backend.security;

import java.util.Optional;

import org.springframework.stereotype.Service;

import com.clutch.backend.auth.domain.Account;
import com.clutch.backend.auth.repo.AccountRepository;
import com.clutch.backend.global.ApiException;
import com.clutch.backend.global.ErrorCode;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Access Token -> 현재 계정 복원
 *
 * 정책:
 * - JwtService.verify (서명/만료/구조) 통과 후, type은 반드시 access
 * - sub의 계정이 없거나 비활성이면 TOKEN_INVALID
 * - verifyOptional: TOKEN_EXPIRED / TOKEN_INVALID 를 삼키고 empty (그 외 장애는 그대로 던짐)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AccessTokenVerifier {

    private final JwtService jwtService;
    private final AccountRepository accountRepository;

    public Account verify(String accessToken) {
        TokenClaims claims = jwtService.verify(accessToken);

        // refresh 토큰을 Authorization 헤더에 넣은 경우
        if (claims.kind() != TokenKind.ACCESS) {
            log.debug("access 검증 거부: kind={}", claims.kind());
            throw new ApiException(ErrorCode.TOKEN_INVALID);
        }

        return accountRepository.findById(claims.accountId())
                .filter(Account::isActive)
                .orElseThrow(() -> {
                    log.debug("access 검증 거부: 계정 없음 또는 비활성 accountId={}", claims.accountId());
                    return new ApiException(ErrorCode.TOKEN_INVALID);
                });
    }

    public Optional<Account> verifyOptional(String accessToken) {
        if (accessToken == null || accessToken.isBlank()) {
            return Optional.empty();
        }

        try {
            return Optional.of(verify(accessToken));
        } catch (ApiException e) {
            if (e.is(ErrorCode.TOKEN_EXPIRED) || e.is(ErrorCode.TOKEN_INVALID)) {
                return Optional.empty();
            }
            throw e;
        }
    }
}
