package com.clutch.backend.auth.session.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.security.SecureRandom;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.clutch.backend.auth.session.domain.Session;
import com.clutch.backend.auth.session.support.SessionIdGenerator;
import com.clutch.backend.global.ApiException;
import com.clutch.backend.global.ErrorCode;
import com.clutch.backend.infra.TestClockConfig.MutableClock;

/**
 * SessionStore 구현체 공통 계약 테스트.
 * 구현체별 테스트가 상속해서 newStore()만 채운다.
 */
abstract class AbstractSessionStoreTest {

    protected static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");
    protected static final Duration TTL = Duration.ofDays(14);

    protected static final String IP = "10.0.0.1";
    protected static final String UA = "JUnit-Agent/1.0";

    protected MutableClock clock;
    protected SessionIdGenerator idGenerator;
    protected SessionStore store;

    protected abstract SessionStore newStore(SessionIdGenerator idGenerator, MutableClock clock);

    @BeforeEach
    void setUpStore() {
        clock = MutableClock.startingAt(T0);
        idGenerator = new SessionIdGenerator(new SecureRandom());
        store = newStore(idGenerator, clock);
    }

    protected Session open(long accountId, String ip, String ua) {
        return Session.open(accountId, ip, ua, clock.instant(), clock.instant().plus(TTL));
    }

    @Test
    @DisplayName("create: id 발급 + id/신원 두 경로로 조회 가능")
    void create_and_find() {
        Session created = store.create(open(1L, IP, UA));

        assertThat(created.id()).isNotBlank();
        assertThat(store.findById(created.id())).contains(created);
        assertThat(store.findByIdentity(1L, IP, UA)).contains(created);
    }

    @Test
    @DisplayName("create: 매번 다른 id")
    void create_generates_unique_ids() {
        Session a = store.create(open(1L, IP, UA));
        Session b = store.create(open(2L, IP, UA));

        assertThat(a.id()).isNotEqualTo(b.id());
    }

    @Test
    @DisplayName("create: expiresAt <= now 이면 SESSION_INVALID_STATE")
    void create_rejects_non_positive_ttl() {
        Session expired = Session.open(1L, IP, UA, T0, T0);

        assertCode(() -> store.create(expired), ErrorCode.SESSION_INVALID_STATE);
    }

    @Test
    @DisplayName("신원 인덱스는 (계정, IP, UA) 셋 다 같아야 맞는다")
    void identity_is_the_full_triple() {
        store.create(open(1L, IP, UA));

        assertThat(store.findByIdentity(1L, IP, UA)).isPresent();
        assertThat(store.findByIdentity(2L, IP, UA)).isEmpty();
        assertThat(store.findByIdentity(1L, "10.0.0.2", UA)).isEmpty();
        assertThat(store.findByIdentity(1L, IP, "Other-Agent")).isEmpty();
    }

    @Test
    @DisplayName("없는 id / null id -> empty")
    void find_unknown() {
        assertThat(store.findById("no-such-session")).isEmpty();
        assertThat(store.findById(null)).isEmpty();
    }

    @Test
    @DisplayName("만료 시각이 지나면 어떤 조회 경로에서도 없다")
    void expired_is_absent() {
        Session created = store.create(open(1L, IP, UA));

        clock.advance(TTL);

        assertThat(store.findById(created.id())).isEmpty();
        assertThat(store.findByIdentity(1L, IP, UA)).isEmpty();
    }

    @Test
    @DisplayName("update: id 유지 + expiresAt 연장 + updatedAt = now")
    void update_extends_expiry() {
        Session created = store.create(open(1L, IP, UA));
        clock.advance(Duration.ofHours(1));
        Instant newExpiry = clock.instant().plus(TTL);

        Session updated = store.update(created.withExpiresAt(newExpiry));

        assertThat(updated.id()).isEqualTo(created.id());
        assertThat(updated.expiresAt()).isEqualTo(newExpiry);
        assertThat(updated.updatedAt()).isEqualTo(clock.instant());
        assertThat(updated.createdAt()).isEqualTo(T0);
        assertThat(store.findById(created.id())).contains(updated);
    }

    @Test
    @DisplayName("update: 대상 없음 -> SESSION_NOT_FOUND, 과거 expiresAt -> SESSION_INVALID_STATE")
    void update_failures() {
        Session ghost = open(1L, IP, UA).withId("ghost");
        assertCode(() -> store.update(ghost), ErrorCode.SESSION_NOT_FOUND);

        Session created = store.create(open(1L, IP, UA));
        assertCode(() -> store.update(created.withExpiresAt(T0.minusSeconds(1))), ErrorCode.SESSION_INVALID_STATE);
    }

    @Test
    @DisplayName("rotate: 새 id로 이동 + 기존 id 삭제 + 인덱스 재지정 + createdAt 유지")
    void rotate_moves_record() {
        Session created = store.create(open(1L, IP, UA));
        clock.advance(Duration.ofMinutes(10));
        Instant newExpiry = clock.instant().plus(TTL);

        Session rotated = store.rotate(created.withExpiresAt(newExpiry));

        assertThat(rotated.id()).isNotEqualTo(created.id());
        assertThat(rotated.createdAt()).isEqualTo(created.createdAt());
        assertThat(rotated.updatedAt()).isEqualTo(clock.instant());
        assertThat(rotated.expiresAt()).isEqualTo(newExpiry);

        assertThat(store.findById(created.id())).isEmpty();
        assertThat(store.findById(rotated.id())).contains(rotated);
        assertThat(store.findByIdentity(1L, IP, UA)).contains(rotated);
    }

    @Test
    @DisplayName("rotate: 같은 id로 두 번째 rotate -> SESSION_NOT_FOUND")
    void rotate_is_single_use() {
        Session created = store.create(open(1L, IP, UA));
        Session extended = created.withExpiresAt(clock.instant().plus(TTL));

        store.rotate(extended);

        assertCode(() -> store.rotate(extended), ErrorCode.SESSION_NOT_FOUND);
    }

    @Test
    @DisplayName("rotate: 만료된 세션 -> SESSION_NOT_FOUND")
    void rotate_expired() {
        Session created = store.create(open(1L, IP, UA));
        clock.advance(TTL.plusSeconds(1));

        assertCode(() -> store.rotate(created.withExpiresAt(clock.instant().plus(TTL))), ErrorCode.SESSION_NOT_FOUND);
    }

    @Test
    @DisplayName("rotate 경합: 같은 세션을 동시에 rotate하면 정확히 하나만 성공")
    void concurrent_rotate_has_single_winner() throws Exception {
        Session created = store.create(open(1L, IP, UA));
        Session extended = created.withExpiresAt(clock.instant().plus(TTL));

        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch gate = new CountDownLatch(1);

        try {
            List<Future<Session>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                Callable<Session> task = () -> {
                    gate.await();
                    try {
                        return store.rotate(extended);
                    } catch (ApiException e) {
                        assertThat(e.getErrorCode()).isEqualTo(ErrorCode.SESSION_NOT_FOUND);
                        return null;
                    }
                };
                futures.add(pool.submit(task));
            }
            gate.countDown();

            List<Session> winners = new ArrayList<>();
            for (Future<Session> f : futures) {
                Session s = f.get(30, TimeUnit.SECONDS);
                if (s != null) winners.add(s);
            }

            assertThat(winners).hasSize(1);
            assertThat(store.findByIdentity(1L, IP, UA)).contains(winners.get(0));
            assertThat(store.findById(created.id())).isEmpty();
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("delete: 있으면 true(레코드 + 인덱스 삭제), 두 번째는 false")
    void delete_is_idempotent() {
        Session created = store.create(open(1L, IP, UA));

        assertThat(store.delete(created.id())).isTrue();
        assertThat(store.findById(created.id())).isEmpty();
        assertThat(store.findByIdentity(1L, IP, UA)).isEmpty();

        assertThat(store.delete(created.id())).isFalse();
        assertThat(store.delete(null)).isFalse();
    }

    @Test
    @DisplayName("delete: 인덱스가 더 새로운 세션을 가리키면 인덱스는 남긴다")
    void delete_keeps_index_of_newer_session() {
        Session older = store.create(open(1L, IP, UA));
        Session newer = store.create(open(1L, IP, UA));

        store.delete(older.id());

        assertThat(store.findByIdentity(1L, IP, UA)).contains(newer);
    }

    protected static void assertCode(ThrowingCallable call, ErrorCode code) {
        assertThatThrownBy(call)
                .isInstanceOf(ApiException.class)
                .extracting(e -> ((ApiException) e).getErrorCode())
                .isEqualTo(code);
    }
}
