package com.guestlist.backend.auth.token.store;

import java.time.Clock;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 자연 만료가 지난 refresh 기록을 주기적으로 정리한다.
 * 스케줄러 스레드에서 돌고, 검증 경로는 막지 않는다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RevocationPurgeJob {

    private final RevocationStore store;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${app.auth.revocation.purge-interval:PT10M}",
               initialDelayString = "${app.auth.revocation.purge-interval:PT10M}")
    public void purgeExpired() {
        try {
            int purged = store.purgeExpired(clock.instant());
            if (purged > 0) {
                log.info("Purged {} expired refresh token records", purged);
            }
        } catch (RuntimeException e) {
            // 다음 주기에 다시 시도
            log.warn("Refresh token purge failed: {}", e.getMessage(), e);
        }
    }
}
