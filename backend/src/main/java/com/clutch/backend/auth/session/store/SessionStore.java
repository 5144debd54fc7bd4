package com.clutch.backend.auth.session.store;

import java.util.Optional;

import com.clutch.backend.auth.session.domain.Session;

/**
 * 세션 저장소 계약
 *
 * 레코드 + "신원 인덱스"(hash(accountId, ip, ua) -> sessionId) 두 가지를 같은 TTL로 관리한다.
 *
 * 실패:
 * - SESSION_NOT_FOUND: update/rotate 대상이 없음 (이미 만료되었거나 다른 요청이 먼저 rotate함)
 * - SESSION_INVALID_STATE: expiresAt이 지금보다 과거/같음 (TTL <= 0)
 * - SESSION_STORE_UNAVAILABLE: 저장소 연결/명령 실패
 */
public interface SessionStore {

    /** id를 새로 발급해서 저장하고, id가 채워진 세션을 돌려준다. */
    Session create(Session session);

    Optional<Session> findById(String sessionId);

    Optional<Session> findByIdentity(Long accountId, String ipAddress, String userAgent);

    /** 같은 id로 덮어쓴다. updatedAt은 저장소가 now로 채운다. */
    Session update(Session session);

    /**
     * session.id()의 레코드를 새 id로 원자적으로 옮긴다.
     * - 새 레코드 쓰기 + 인덱스 재지정 + 기존 레코드 삭제가 한 번에 반영되거나 전혀 반영되지 않는다.
     * - 같은 id로 동시에 들어온 rotate 중 하나만 성공한다. 나머지는 SESSION_NOT_FOUND.
     * - createdAt은 기존 값을 유지한다.
     */
    Session rotate(Session session);

    /** 레코드 + (아직 이 id를 가리키면) 인덱스 삭제. 있었으면 true. */
    boolean delete(String sessionId);

    /** TTL이 없는 저장소용 정리 훅. 지운 세션 수. */
    int deleteExpired();
}
