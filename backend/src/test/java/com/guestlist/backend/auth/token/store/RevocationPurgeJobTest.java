package com.guestlist.backend.auth.token.store;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import java.time.Instant;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.QueryTimeoutException;

import com.guestlist.backend.support.MutableClock;

@DisplayName("[Store] RevocationPurgeJob")
class RevocationPurgeJobTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Test
    @DisplayName("현재 시각 기준으로 purge를 호출한다")
    void purges_with_current_time() {
        RevocationStore store = mock(RevocationStore.class);
        RevocationPurgeJob job = new RevocationPurgeJob(store, new MutableClock(NOW));

        job.purgeExpired();

        verify(store).purgeExpired(NOW);
    }

    @Test
    @DisplayName("store 예외는 스케줄러 밖으로 던지지 않는다")
    void store_failure_does_not_escape() {
        RevocationStore store = mock(RevocationStore.class);
        given(store.purgeExpired(any())).willThrow(new QueryTimeoutException("timeout"));
        RevocationPurgeJob job = new RevocationPurgeJob(store, new MutableClock(NOW));

        assertThatCode(job::purgeExpired).doesNotThrowAnyException();
    }
}
