package com.clutch.backend.auth.token.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.security.SecureRandom;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.clutch.backend.auth.domain.Account;
import com.clutch.backend.auth.repo.AccountRepository;
import com.clutch.backend.auth.session.domain.Session;
import com.clutch.backend.auth.session.store.InMemorySessionStore;
import com.clutch.backend.auth.session.store.SessionStore;
import com.clutch.backend.auth.session.support.SessionIdGenerator;
import com.clutch.backend.auth.support.AuthFixtures;
import com.clutch.backend.auth.support.ClientInfo;
import com.clutch.backend.auth.token.service.RefreshTokenService.RefreshResult;
import com.clutch.backend.global.ApiException;
import com.clutch.backend.global.ErrorCode;
import com.clutch.backend.infra.TestClockConfig.MutableClock;
import com.clutch.backend.security.JwtService;
import com.clutch.backend.security.TokenClaims;
import com.clutch.backend.security.TokenSubject;

@ExtendWith(MockitoExtension.class)
@DisplayName("[Auth][Refresh] 리프레시 로테이션 / 로그아웃")
class RefreshTokenServiceTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");
    private static final ClientInfo CLIENT = new ClientInfo("10.0.0.1", "JUnit-Agent/1.0");

    @Mock AccountRepository accountRepository;

    private MutableClock clock;
    private InMemorySessionStore sessionStore;
    private JwtService jwtService;
    private RefreshTokenService service;
    private Account account;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt(T0);
        sessionStore = new InMemorySessionStore(new SessionIdGenerator(new SecureRandom()), clock);
        jwtService = new JwtService(AuthFixtures.props(), clock);
        service = new RefreshTokenService(jwtService, accountRepository, sessionStore, AuthFixtures.props(), clock);

        account = AuthFixtures.account(1L, T0);
        lenient().when(accountRepository.findById(1L)).thenReturn(Optional.of(account));
    }

    /** 로그인과 같은 상태: 세션 1개 + 그 세션을 가리키는 refresh */
    private String loginRefreshToken(ClientInfo client) {
        Session session = sessionStore.create(Session.open(
                1L, client.ip(), client.userAgent(), clock.instant(),
                clock.instant().plusSeconds(AuthFixtures.SESSION_TTL)));
        return jwtService.mintRefresh(TokenSubject.of(account, session.id()));
    }

    @Test
    @DisplayName("T0 로그인 -> T1 refresh(R1) 성공 -> T2 refresh(R2) 성공 -> R1 재사용 거부")
    void rotation_chain_and_reuse() {
        String r1 = loginRefreshToken(CLIENT);
        String s1 = jwtService.verifyRefresh(r1).sessionId();

        clock.advance(Duration.ofMinutes(10));
        RefreshResult first = service.refresh(r1, CLIENT);
        TokenClaims c2 = jwtService.verifyRefresh(first.tokens().refreshToken());

        assertThat(c2.sessionId()).isNotEqualTo(s1);
        assertThat(jwtService.verify(first.tokens().accessToken()).sessionId()).isEqualTo(c2.sessionId());
        assertThat(sessionStore.findById(s1)).isEmpty();

        Session s2 = sessionStore.findById(c2.sessionId()).orElseThrow();
        assertThat(s2.expiresAt()).isEqualTo(clock.instant().plusSeconds(AuthFixtures.SESSION_TTL));
        assertThat(s2.createdAt()).isEqualTo(T0);

        clock.advance(Duration.ofMinutes(10));
        RefreshResult second = service.refresh(first.tokens().refreshToken(), CLIENT);
        assertThat(jwtService.verifyRefresh(second.tokens().refreshToken()).sessionId())
                .isNotEqualTo(c2.sessionId());

        assertRejected(() -> service.refresh(r1, CLIENT), ErrorCode.TOKEN_INVALID);
        assertRejected(() -> service.refresh(first.tokens().refreshToken(), CLIENT), ErrorCode.TOKEN_INVALID);
    }

    @Test
    @DisplayName("다른 IP / 다른 UA -> TOKEN_INVALID, 세션은 그대로 남는다")
    void binding_mismatch() {
        String r1 = loginRefreshToken(CLIENT);
        String sid = jwtService.verifyRefresh(r1).sessionId();

        assertRejected(() -> service.refresh(r1, new ClientInfo("10.9.9.9", CLIENT.userAgent())), ErrorCode.TOKEN_INVALID);
        assertRejected(() -> service.refresh(r1, new ClientInfo(CLIENT.ip(), "Evil-Agent")), ErrorCode.TOKEN_INVALID);

        assertThat(sessionStore.findById(sid)).isPresent();
        assertThat(service.refresh(r1, CLIENT).tokens().refreshToken()).isNotBlank();
    }

    @Test
    @DisplayName("세션의 계정이 토큰 sub와 다르면 TOKEN_INVALID")
    void session_of_another_account() {
        Session foreign = sessionStore.create(Session.open(
                2L, CLIENT.ip(), CLIENT.userAgent(), T0, T0.plusSeconds(AuthFixtures.SESSION_TTL)));
        String forged = jwtService.mintRefresh(new TokenSubject(1L, false, foreign.id()));

        assertRejected(() -> service.refresh(forged, CLIENT), ErrorCode.TOKEN_INVALID);
    }

    @Test
    @DisplayName("access 토큰 / session_id 없는 refresh -> TOKEN_INVALID")
    void wrong_token_shapes() {
        String sid = jwtService.verifyRefresh(loginRefreshToken(CLIENT)).sessionId();

        String access = jwtService.mintAccess(new TokenSubject(1L, false, sid));
        String noSession = jwtService.mintRefresh(new TokenSubject(1L, false, null));

        assertRejected(() -> service.refresh(access, CLIENT), ErrorCode.TOKEN_INVALID);
        assertRejected(() -> service.refresh(noSession, CLIENT), ErrorCode.TOKEN_INVALID);
        assertRejected(() -> service.refresh("garbage", CLIENT), ErrorCode.TOKEN_INVALID);
    }

    @Test
    @DisplayName("refresh JWT 만료 -> TOKEN_EXPIRED")
    void expired_refresh_token() {
        String r1 = loginRefreshToken(CLIENT);
        clock.advance(Duration.ofSeconds(AuthFixtures.REFRESH_TTL + 1));

        assertRejected(() -> service.refresh(r1, CLIENT), ErrorCode.TOKEN_EXPIRED);
    }

    @Test
    @DisplayName("계정 비활성 / 삭제 -> TOKEN_INVALID")
    void inactive_or_missing_account() {
        String r1 = loginRefreshToken(CLIENT);

        account.deactivate(T0);
        assertRejected(() -> service.refresh(r1, CLIENT), ErrorCode.TOKEN_INVALID);

        when(accountRepository.findById(1L)).thenReturn(Optional.empty());
        assertRejected(() -> service.refresh(r1, CLIENT), ErrorCode.TOKEN_INVALID);
    }

    @Test
    @DisplayName("저장소가 만료된 세션을 돌려주면 삭제 후 TOKEN_INVALID")
    void expired_session_record_is_deleted() {
        SessionStore store = mock(SessionStore.class);
        RefreshTokenService svc = new RefreshTokenService(jwtService, accountRepository, store, AuthFixtures.props(), clock);

        Session stale = new Session("sid-stale", 1L, CLIENT.ip(), CLIENT.userAgent(),
                T0.minusSeconds(120), T0.minusSeconds(120), T0.minusSeconds(1));
        when(store.findById("sid-stale")).thenReturn(Optional.of(stale));

        String token = jwtService.mintRefresh(new TokenSubject(1L, false, "sid-stale"));

        assertRejected(() -> svc.refresh(token, CLIENT), ErrorCode.TOKEN_INVALID);
        verify(store).delete("sid-stale");
        verify(store, never()).rotate(any());
    }

    @Test
    @DisplayName("rotate에서 SESSION_NOT_FOUND -> TOKEN_INVALID, 저장소 장애는 그대로 전파")
    void rotate_failures() {
        SessionStore store = mock(SessionStore.class);
        RefreshTokenService svc = new RefreshTokenService(jwtService, accountRepository, store, AuthFixtures.props(), clock);

        Session live = Session.open(1L, CLIENT.ip(), CLIENT.userAgent(), T0, T0.plusSeconds(60)).withId("sid");
        when(store.findById("sid")).thenReturn(Optional.of(live));
        String token = jwtService.mintRefresh(new TokenSubject(1L, false, "sid"));

        when(store.rotate(any())).thenThrow(new ApiException(ErrorCode.SESSION_NOT_FOUND));
        assertRejected(() -> svc.refresh(token, CLIENT), ErrorCode.TOKEN_INVALID);

        doThrow(new ApiException(ErrorCode.SESSION_STORE_UNAVAILABLE)).when(store).rotate(any());
        assertRejected(() -> svc.refresh(token, CLIENT), ErrorCode.SESSION_STORE_UNAVAILABLE);
    }

    @Test
    @DisplayName("같은 refresh로 동시에 두 요청 -> 하나만 성공, 나머지는 TOKEN_INVALID")
    void concurrent_refresh_single_winner() throws Exception {
        String r1 = loginRefreshToken(CLIENT);

        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch gate = new CountDownLatch(1);
        try {
            List<Future<RefreshResult>> futures = new ArrayList<>();
            for (int i = 0; i < 2; i++) {
                futures.add(pool.submit(() -> {
                    gate.await();
                    try {
                        return service.refresh(r1, CLIENT);
                    } catch (ApiException e) {
                        assertThat(e.getErrorCode()).isEqualTo(ErrorCode.TOKEN_INVALID);
                        return null;
                    }
                }));
            }
            gate.countDown();

            int winners = 0;
            for (Future<RefreshResult> f : futures) {
                if (f.get(10, TimeUnit.SECONDS) != null) winners++;
            }
            assertThat(winners).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("logout: 세션 삭제 -> 같은 refresh 재사용 거부, 두 번째 logout도 조용히 끝남")
    void logout_is_idempotent() {
        String r1 = loginRefreshToken(CLIENT);
        String sid = jwtService.verifyRefresh(r1).sessionId();

        service.logout(r1);

        assertThat(sessionStore.findById(sid)).isEmpty();
        assertRejected(() -> service.refresh(r1, CLIENT), ErrorCode.TOKEN_INVALID);

        service.logout(r1);
        service.logout(null);
        service.logout("garbage");
    }

    @Test
    @DisplayName("logout: 만료된 refresh여도 예외 없이 끝난다")
    void logout_with_expired_token() {
        String r1 = loginRefreshToken(CLIENT);
        clock.advance(Duration.ofSeconds(AuthFixtures.REFRESH_TTL + 1));

        service.logout(r1);
    }

    private static void assertRejected(ThrowingCallable call, ErrorCode code) {
        assertThatThrownBy(call)
                .isInstanceOf(ApiException.class)
                .extracting(e -> ((ApiException) e).getErrorCode())
                .isEqualTo(code);
    }
}
