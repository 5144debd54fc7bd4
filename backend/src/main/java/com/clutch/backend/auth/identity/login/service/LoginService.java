package com.clutch.backend.auth.identity.login.service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

import org.springframework.stereotype.Service;

import com.clutch.backend.auth.config.AuthProperties;
import com.clutch.backend.auth.domain.Account;
import com.clutch.backend.auth.session.domain.Session;
import com.clutch.backend.auth.session.store.SessionStore;
import com.clutch.backend.auth.support.ClientInfo;
import com.clutch.backend.global.ApiException;
import com.clutch.backend.global.ErrorCode;
import com.clutch.backend.security.JwtService;
import com.clutch.backend.security.TokenPair;
import com.clutch.backend.security.TokenSubject;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 로그인 유스케이스
 *
 * 흐름:
 * 1) CredentialVerifier로 계정 확인 (실패는 INVALID_CREDENTIALS 그대로 전파)
 * 2) (accountId, ip, ua) 세션이 이미 있으면 expiresAt만 연장 (id 유지), 없으면 새로 생성
 *    - 조회와 update 사이에 만료돼서 SESSION_NOT_FOUND가 나면 새로 만든다.
 * 3) access + refresh 발급 (둘 다 session_id 포함)
 *
 * 로그인 갱신은 세션 id를 바꾸지 않는다. id 교체(rotate)는 refresh 때만 일어난다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LoginService {

    private final CredentialVerifier credentialVerifier;
    private final SessionStore sessionStore;
    private final JwtService jwtService;
    private final AuthProperties props;
    private final Clock clock;

    public LoginResult login(String email, String password, ClientInfo client) {
        if (client == null) throw new IllegalArgumentException("client must not be null");

        Account account = credentialVerifier.verify(email, password);
        Session session = openOrRenewSession(account, client);

        TokenPair tokens = jwtService.mintPair(TokenSubject.of(account, session.id()));

        log.info("로그인 성공: accountId={}", account.getId());
        return new LoginResult(tokens, account);
    }

    private Session openOrRenewSession(Account account, ClientInfo client) {
        Instant now = clock.instant();
        Instant expiresAt = now.plusSeconds(props.session().ttlSeconds());

        Optional<Session> existing = sessionStore.findByIdentity(account.getId(), client.ip(), client.userAgent());
        if (existing.isPresent()) {
            try {
                return sessionStore.update(existing.get().withExpiresAt(expiresAt));
            } catch (ApiException e) {
                if (!e.is(ErrorCode.SESSION_NOT_FOUND)) {
                    throw e;
                }
                log.debug("갱신 대상 세션이 사라져 새로 생성: accountId={}", account.getId());
            }
        }

        return sessionStore.create(Session.open(account.getId(), client.ip(), client.userAgent(), now, expiresAt));
    }

    // 컨트롤러가 응답으로 변환하기 위한 서비스 결과
    public record LoginResult(TokenPair tokens, Account account) {
    }
}
