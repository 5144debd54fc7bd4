package com.clutch.backend.auth.token.service;

import java.time.Clock;
import java.time.Instant;

import org.springframework.stereotype.Service;

import com.clutch.backend.auth.config.AuthProperties;
import com.clutch.backend.auth.domain.Account;
import com.clutch.backend.auth.repo.AccountRepository;
import com.clutch.backend.auth.session.domain.Session;
import com.clutch.backend.auth.session.store.SessionStore;
import com.clutch.backend.auth.support.ClientInfo;
import com.clutch.backend.global.ApiException;
import com.clutch.backend.global.ErrorCode;
import com.clutch.backend.security.JwtService;
import com.clutch.backend.security.TokenClaims;
import com.clutch.backend.security.TokenPair;
import com.clutch.backend.security.TokenSubject;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Refresh Token 로테이션 / 로그아웃
 *
 * refresh:
 * 1) verifyRefresh (TOKEN_EXPIRED / TOKEN_INVALID 그대로 전파)
 * 2) session_id 필수
 * 3) 계정 존재 + 활성
 * 4) 세션 존재
 * 5) 세션의 (accountId, ip, ua) == (sub, 요청 ip, 요청 ua)
 * 6) 세션 expiresAt < now 면 세션 삭제 후 거부
 * 7) expiresAt 연장 + rotate 1회 (재시도 없음)
 * 8) 새 session_id로 access + refresh 재발급
 *
 * 2)~7)의 모든 거부는 밖으로는 TOKEN_INVALID 하나로 뭉개고, 실제 사유는 warn 로그로만 남긴다.
 *
 * 동시성:
 * - 같은 refresh로 동시에 두 요청이 오면 rotate는 저장소 트랜잭션에서 하나만 성공한다.
 *   진 쪽은 SESSION_NOT_FOUND -> TOKEN_INVALID. 여기서는 락을 잡지 않는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RefreshTokenService {

    private final JwtService jwtService;
    private final AccountRepository accountRepository;
    private final SessionStore sessionStore;
    private final AuthProperties props;
    private final Clock clock;

    public RefreshResult refresh(String refreshToken, ClientInfo client) {
        if (client == null) throw new IllegalArgumentException("client must not be null");

        TokenClaims claims = jwtService.verifyRefresh(refreshToken);
        if (!claims.hasSessionId()) {
            throw reject("session_id 없음", claims.accountId());
        }

        Account account = accountRepository.findById(claims.accountId())
                .filter(Account::isActive)
                .orElseThrow(() -> reject("계정 없음 또는 비활성", claims.accountId()));

        Session session = sessionStore.findById(claims.sessionId())
                .orElseThrow(() -> reject("세션 없음 또는 만료", claims.accountId()));

        verifyBinding(session, account, client);

        Instant now = clock.instant();
        if (session.expiresAt().isBefore(now)) {
            sessionStore.delete(session.id());
            throw reject("세션 만료", account.getId());
        }

        Session rotated;
        try {
            rotated = sessionStore.rotate(session.withExpiresAt(now.plusSeconds(props.session().ttlSeconds())));
        } catch (ApiException e) {
            if (e.is(ErrorCode.SESSION_NOT_FOUND)) {
                throw reject("rotate 실패(이미 사용된 refresh)", account.getId());
            }
            throw e;
        }

        TokenPair tokens = jwtService.mintPair(TokenSubject.of(account, rotated.id()));

        log.info("리프레시 성공: accountId={}", account.getId());
        return new RefreshResult(tokens, account);
    }

    /**
     * 로그아웃 (멱등)
     * - 토큰 없음 / 검증 실패 / 세션 이미 없음 -> 아무 것도 하지 않는다.
     * - 유효한 refresh면 그 세션을 삭제한다. 이후 같은 refresh는 4)에서 거부된다.
     */
    public void logout(String refreshToken) {
        if (refreshToken == null || refreshToken.isBlank()) {
            return;
        }

        TokenClaims claims;
        try {
            claims = jwtService.verifyRefresh(refreshToken);
        } catch (ApiException e) {
            log.debug("로그아웃: 검증 실패한 refresh 무시 code={}", e.getCode());
            return;
        }

        if (!claims.hasSessionId()) {
            return;
        }

        boolean deleted = sessionStore.delete(claims.sessionId());
        log.info("로그아웃: accountId={}, sessionDeleted={}", claims.accountId(), deleted);
    }

    private void verifyBinding(Session session, Account account, ClientInfo client) {
        if (!session.accountId().equals(account.getId())) {
            throw reject("세션 계정 불일치", account.getId());
        }
        if (!session.ipAddress().equals(client.ip())) {
            throw reject("세션 IP 불일치", account.getId());
        }
        if (!session.userAgent().equals(client.userAgent())) {
            throw reject("세션 User-Agent 불일치", account.getId());
        }
    }

    private static ApiException reject(String reason, Long accountId) {
        log.warn("리프레시 거부: reason={}, accountId={}", reason, accountId);
        return new ApiException(ErrorCode.TOKEN_INVALID);
    }

    public record RefreshResult(TokenPair tokens, Account account) {}
}
