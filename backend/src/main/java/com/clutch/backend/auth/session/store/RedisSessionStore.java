package com.clutch.backend.auth.session.store;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import com.clutch.backend.auth.config.AuthProperties;
import com.clutch.backend.auth.session.domain.Session;
import com.clutch.backend.auth.session.support.SessionIdGenerator;
import com.clutch.backend.auth.session.support.SessionIdentityHasher;
import com.clutch.backend.global.ApiException;
import com.clutch.backend.global.ErrorCode;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.slf4j.Slf4j;

/**
 * Redis 기반 세션 저장소
 *
 * 키 공간 (prefix 기본값 "auth:session:"):
 * - {prefix}{sessionId}         -> 세션 JSON          (TTL = expiresAt - now)
 * - {prefix}user:{identityHash} -> sessionId          (레코드와 같은 TTL)
 *
 * rotate:
 * - WATCH old -> GET old -> MULTI { SET new, SET index, DEL old } -> EXEC
 * - 그 사이 old가 바뀌거나 지워지면 EXEC가 취소되고 SESSION_NOT_FOUND. (동시 rotate는 하나만 성공)
 *
 * update:
 * - WATCH id -> GET id -> MULTI { SET id, SET index } -> EXEC
 * - 취소되면 SESSION_NOT_FOUND. 이미 rotate된 세션을 되살리지 않는다.
 *
 * Redis 연결/명령 실패는 SESSION_STORE_UNAVAILABLE 로 감싼다. 재시도는 하지 않는다.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "app.auth.session", name = "store", havingValue = "redis", matchIfMissing = true)
public class RedisSessionStore implements SessionStore {

    private static final String INDEX_SEGMENT = "user:";

    private final StringRedisTemplate redis;
    private final ObjectMapper objectMapper;
    private final SessionIdGenerator idGenerator;
    private final Clock clock;
    private final String keyPrefix;

    public RedisSessionStore(
            StringRedisTemplate redis,
            ObjectMapper objectMapper,
            SessionIdGenerator idGenerator,
            AuthProperties props,
            Clock clock
    ) {
        this.redis = redis;
        this.objectMapper = objectMapper;
        this.idGenerator = idGenerator;
        this.clock = clock;
        this.keyPrefix = props.session().keyPrefix();
    }

    @Override
    public Session create(Session session) {
        requireSession(session);

        Duration ttl = SessionTtls.remaining(session.expiresAt(), clock.instant());
        Session created = session.withId(idGenerator.generate());
        String json = write(created);

        return execute(() -> {
            redis.opsForValue().set(sessionKey(created.id()), json, ttl);
            redis.opsForValue().set(indexKey(created), created.id(), ttl);
            return created;
        });
    }

    @Override
    public Optional<Session> findById(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            return Optional.empty();
        }

        Instant now = clock.instant();
        return execute(() -> Optional.ofNullable(redis.opsForValue().get(sessionKey(sessionId))))
                .map(this::read)
                .filter(s -> !s.isExpiredAt(now));
    }

    @Override
    public Optional<Session> findByIdentity(Long accountId, String ipAddress, String userAgent) {
        String indexKey = indexKey(SessionIdentityHasher.hash(accountId, ipAddress, userAgent));
        String sessionId = execute(() -> redis.opsForValue().get(indexKey));

        // 인덱스는 있는데 레코드가 없으면(만료 경합) 없는 것으로 본다.
        return sessionId == null ? Optional.empty() : findById(sessionId);
    }

    @Override
    public Session update(Session session) {
        requireSessionWithId(session);

        Instant now = clock.instant();
        Duration ttl = SessionTtls.remaining(session.expiresAt(), now);
        Session updated = session.withUpdatedAt(now);

        String key = sessionKey(updated.id());
        String json = write(updated);
        String indexKey = indexKey(updated);

        // rotate와 같은 WATCH 트랜잭션: 확인 후 쓰기 사이에 rotate/delete가 끼면 EXEC가 취소된다.
        Boolean written = execute(() -> redis.execute(new SessionCallback<Boolean>() {
            @Override
            @SuppressWarnings("unchecked")
            public <K, V> Boolean execute(RedisOperations<K, V> operations) throws DataAccessException {
                RedisOperations<String, String> ops = (RedisOperations<String, String>) operations;

                ops.watch(key);

                String currentJson = ops.opsForValue().get(key);
                if (currentJson == null || read(currentJson).isExpiredAt(now)) {
                    ops.unwatch();
                    return false;
                }

                ops.multi();
                ops.opsForValue().set(key, json, ttl);
                ops.opsForValue().set(indexKey, updated.id(), ttl);
                List<Object> results = ops.exec();

                return results != null && !results.isEmpty();
            }
        }));

        if (!Boolean.TRUE.equals(written)) {
            throw new ApiException(ErrorCode.SESSION_NOT_FOUND);
        }
        return updated;
    }

    @Override
    public Session rotate(Session session) {
        requireSessionWithId(session);

        Instant now = clock.instant();
        Duration ttl = SessionTtls.remaining(session.expiresAt(), now);

        String oldKey = sessionKey(session.id());
        String newId = idGenerator.generate();

        Session rotated = execute(() -> redis.execute(new SessionCallback<Session>() {
            @Override
            @SuppressWarnings("unchecked")
            public <K, V> Session execute(RedisOperations<K, V> operations) throws DataAccessException {
                RedisOperations<String, String> ops = (RedisOperations<String, String>) operations;

                ops.watch(oldKey);

                String currentJson = ops.opsForValue().get(oldKey);
                Session current = (currentJson == null) ? null : read(currentJson);
                if (current == null || current.isExpiredAt(now)) {
                    ops.unwatch();
                    return null;
                }

                // createdAt은 최초 로그인 시각을 유지한다.
                Session next = new Session(
                        newId,
                        session.accountId(),
                        session.ipAddress(),
                        session.userAgent(),
                        current.createdAt(),
                        now,
                        session.expiresAt()
                );

                ops.multi();
                ops.opsForValue().set(sessionKey(newId), write(next), ttl);
                ops.opsForValue().set(indexKey(next), newId, ttl);
                ops.delete(oldKey);
                List<Object> results = ops.exec();

                // WATCH 키가 바뀌어 트랜잭션이 취소됨
                if (results == null || results.isEmpty()) {
                    return null;
                }
                return next;
            }
        }));

        if (rotated == null) {
            throw new ApiException(ErrorCode.SESSION_NOT_FOUND);
        }
        return rotated;
    }

    @Override
    public boolean delete(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            return false;
        }

        String key = sessionKey(sessionId);
        return execute(() -> {
            String json = redis.opsForValue().get(key);
            if (json == null) {
                return false;
            }

            Session existing = read(json);
            String indexKey = indexKey(existing);
            redis.delete(key);

            // 인덱스가 이미 다른(더 새로운) 세션을 가리키면 건드리지 않는다.
            if (sessionId.equals(redis.opsForValue().get(indexKey))) {
                redis.delete(indexKey);
            }
            return true;
        });
    }

    /** Redis TTL이 만료를 처리하므로 할 일이 없다. */
    @Override
    public int deleteExpired() {
        return 0;
    }

    private String sessionKey(String sessionId) {
        return keyPrefix + sessionId;
    }

    private String indexKey(Session session) {
        return indexKey(SessionIdentityHasher.hash(session.accountId(), session.ipAddress(), session.userAgent()));
    }

    private String indexKey(String identityHash) {
        return keyPrefix + INDEX_SEGMENT + identityHash;
    }

    private <T> T execute(Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            log.warn("세션 저장소 접근 실패: {}", e.getMessage());
            throw new ApiException(ErrorCode.SESSION_STORE_UNAVAILABLE, e);
        }
    }

    private String write(Session session) {
        try {
            return objectMapper.writeValueAsString(session);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize session", e);
        }
    }

    private Session read(String json) {
        try {
            return objectMapper.readValue(json, Session.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupted session record", e);
        }
    }

    private static void requireSession(Session session) {
        if (session == null) throw new IllegalArgumentException("session must not be null");
    }

    private static void requireSessionWithId(Session session) {
        requireSession(session);
        if (session.id() == null || session.id().isBlank()) {
            throw new IllegalArgumentException("session id must not be blank");
        }
    }
}
