package com.clutch.backend.auth.session.job;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import com.clutch.backend.auth.session.store.SessionStore;
import com.clutch.backend.global.ApiException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 만료 세션 정리 스케줄러
 *
 * - 주기: app.auth.session.cleanup-interval (fixedDelay, 이전 실행이 끝난 뒤부터 계산)
 * - Redis 저장소는 TTL로 이미 지워지므로 항상 0. 메모리 저장소만 실제로 정리한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExpiredSessionCleanupJob {

    private final SessionStore sessionStore;

    @Scheduled(
            fixedDelayString = "${app.auth.session.cleanup-interval}",
            initialDelayString = "${app.auth.session.cleanup-interval}"
    )
    public void purgeExpiredSessions() {
        try {
            int removed = sessionStore.deleteExpired();
            if (removed > 0) {
                log.info("만료 세션 정리: removed={}", removed);
            }
        } catch (ApiException e) {
            // 다음 주기에 다시 시도한다.
            log.warn("만료 세션 정리 실패: code={}", e.getCode(), e);
        }
    }
}
