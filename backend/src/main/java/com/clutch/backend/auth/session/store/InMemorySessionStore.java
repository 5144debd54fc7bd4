package com.clutch.backend.auth.session.store;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import com.clutch.backend.auth.session.domain.Session;
import com.clutch.backend.auth.session.support.SessionIdGenerator;
import com.clutch.backend.auth.session.support.SessionIdentityHasher;
import com.clutch.backend.global.ApiException;
import com.clutch.backend.global.ErrorCode;

/**
 * 단일 노드/로컬 실행용 메모리 세션 저장소 (app.auth.session.store=memory)
 *
 * - 네이티브 TTL이 없으므로 조회 때마다 expiresAt을 Clock과 비교하고,
 *   실제 제거는 deleteExpired(정리 스케줄러)가 한다.
 * - 모든 연산은 this 모니터로 직렬화된다. rotate 경합에서 두 번째 요청은 old가 이미 지워져 SESSION_NOT_FOUND.
 */
@Component
@ConditionalOnProperty(prefix = "app.auth.session", name = "store", havingValue = "memory")
public class InMemorySessionStore implements SessionStore {

    private final Map<String, Session> sessions = new HashMap<>();
    private final Map<String, String> identityIndex = new HashMap<>(); // identityHash -> sessionId

    private final SessionIdGenerator idGenerator;
    private final Clock clock;

    public InMemorySessionStore(SessionIdGenerator idGenerator, Clock clock) {
        this.idGenerator = idGenerator;
        this.clock = clock;
    }

    @Override
    public synchronized Session create(Session session) {
        if (session == null) throw new IllegalArgumentException("session must not be null");

        SessionTtls.remaining(session.expiresAt(), clock.instant());
        Session created = session.withId(idGenerator.generate());
        put(created);
        return created;
    }

    @Override
    public synchronized Optional<Session> findById(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(liveSession(sessionId, clock.instant()));
    }

    @Override
    public synchronized Optional<Session> findByIdentity(Long accountId, String ipAddress, String userAgent) {
        String sessionId = identityIndex.get(SessionIdentityHasher.hash(accountId, ipAddress, userAgent));
        return sessionId == null ? Optional.empty() : findById(sessionId);
    }

    @Override
    public synchronized Session update(Session session) {
        requireId(session);

        Instant now = clock.instant();
        if (liveSession(session.id(), now) == null) {
            throw new ApiException(ErrorCode.SESSION_NOT_FOUND);
        }
        SessionTtls.remaining(session.expiresAt(), now);

        Session updated = session.withUpdatedAt(now);
        put(updated);
        return updated;
    }

    @Override
    public synchronized Session rotate(Session session) {
        requireId(session);

        Instant now = clock.instant();
        Session current = liveSession(session.id(), now);
        if (current == null) {
            throw new ApiException(ErrorCode.SESSION_NOT_FOUND);
        }
        SessionTtls.remaining(session.expiresAt(), now);

        Session next = new Session(
                idGenerator.generate(),
                session.accountId(),
                session.ipAddress(),
                session.userAgent(),
                current.createdAt(),
                now,
                session.expiresAt()
        );

        put(next);
        sessions.remove(current.id());
        return next;
    }

    @Override
    public synchronized boolean delete(String sessionId) {
        if (sessionId == null) {
            return false;
        }

        Session removed = sessions.remove(sessionId);
        if (removed == null) {
            return false;
        }
        identityIndex.remove(identityHash(removed), sessionId);
        return !removed.isExpiredAt(clock.instant());
    }

    @Override
    public synchronized int deleteExpired() {
        Instant now = clock.instant();
        int removed = 0;

        Iterator<Session> it = sessions.values().iterator();
        while (it.hasNext()) {
            Session s = it.next();
            if (s.isExpiredAt(now)) {
                it.remove();
                identityIndex.remove(identityHash(s), s.id());
                removed++;
            }
        }
        return removed;
    }

    synchronized int size() {
        return sessions.size();
    }

    private Session liveSession(String sessionId, Instant now) {
        Session s = sessions.get(sessionId);
        return (s == null || s.isExpiredAt(now)) ? null : s;
    }

    private void put(Session session) {
        sessions.put(session.id(), session);
        identityIndex.put(identityHash(session), session.id());
    }

    private static String identityHash(Session session) {
        return SessionIdentityHasher.hash(session.accountId(), session.ipAddress(), session.userAgent());
    }

    private static void requireId(Session session) {
        if (session == null) throw new IllegalArgumentException("session must not be null");
        if (session.id() == null || session.id().isBlank()) {
            throw new IllegalArgumentException("session id must not be blank");
        }
    }
}
