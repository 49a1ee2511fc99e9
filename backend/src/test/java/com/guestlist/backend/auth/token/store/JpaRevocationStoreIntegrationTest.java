package com.guestlist.backend.auth.token.store;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import com.guestlist.backend.AbstractIntegrationTest;
import com.guestlist.backend.auth.token.domain.RefreshRevokeReason;
import com.guestlist.backend.auth.token.domain.RevocationEntry;
import com.guestlist.backend.auth.token.repo.TrackedRefreshTokenRepository;

@DisplayName("[Auth][Store] JPA RevocationStore")
class JpaRevocationStoreIntegrationTest extends AbstractIntegrationTest {

    private static final Long OWNER = 7L;
    private static final Long OTHER_OWNER = 8L;

    @Autowired RevocationStore store;
    @Autowired TrackedRefreshTokenRepository repo;

    @BeforeEach
    void clean() {
        repo.deleteAll();
    }

    private static String hash(char c) {
        return String.valueOf(c).repeat(64);
    }

    private static Instant inDays(long days) {
        return Instant.now().plus(Duration.ofDays(days));
    }

    @Test
    @DisplayName("추적만 된 토큰 / 모르는 토큰은 폐기 아님")
    void tracked_or_unknown_is_not_revoked() {
        store.track(hash('a'), OWNER, inDays(7));

        assertThat(store.isRevoked(hash('a'))).isFalse();
        assertThat(store.isRevoked(hash('z'))).isFalse();
        assertThat(store.findRevocation(hash('a'))).isEmpty();
    }

    @Test
    @DisplayName("revoke: 첫 호출만 true, 이후는 false (멱등) + 사유 보존")
    void revoke_is_compare_and_set() {
        store.track(hash('a'), OWNER, inDays(7));

        assertThat(store.revoke(hash('a'), OWNER, inDays(7), RefreshRevokeReason.ROTATED)).isTrue();
        assertThat(store.revoke(hash('a'), OWNER, inDays(7), RefreshRevokeReason.LOGOUT)).isFalse();

        assertThat(store.isRevoked(hash('a'))).isTrue();
        RevocationEntry entry = store.findRevocation(hash('a')).orElseThrow();
        assertThat(entry.reason()).isEqualTo(RefreshRevokeReason.ROTATED);
        assertThat(entry.ownerId()).isEqualTo(OWNER);
    }

    @Test
    @DisplayName("추적 안 된 토큰도 폐기 가능")
    void revoke_untracked_token() {
        assertThat(store.revoke(hash('b'), OWNER, inDays(7), RefreshRevokeReason.LOGOUT)).isTrue();
        assertThat(store.isRevoked(hash('b'))).isTrue();
    }

    @Test
    @DisplayName("추적 안 된 같은 토큰을 동시에 폐기해도 true는 정확히 한 번, 나머지는 예외 없이 false")
    void concurrent_revoke_of_untracked_token() throws Exception {
        int threads = 4;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        Instant exp = inDays(7);

        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return store.revoke(hash('d'), OWNER, exp, RefreshRevokeReason.LOGOUT);
                }));
            }
            start.countDown();

            int winners = 0;
            for (Future<Boolean> f : results) {
                if (f.get(30, TimeUnit.SECONDS)) winners++;
            }
            assertThat(winners).isEqualTo(1);
            assertThat(store.isRevoked(hash('d'))).isTrue();
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("revokeAll: 해당 유저의 활성 토큰만 폐기, 다른 유저는 그대로")
    void revoke_all_only_touches_owner() {
        store.track(hash('a'), OWNER, inDays(7));
        store.track(hash('b'), OWNER, inDays(7));
        store.track(hash('c'), OTHER_OWNER, inDays(7));
        store.revoke(hash('a'), OWNER, inDays(7), RefreshRevokeReason.ROTATED);

        int revoked = store.revokeAll(OWNER, RefreshRevokeReason.LOGOUT_ALL);

        assertThat(revoked).isEqualTo(1);
        assertThat(store.isRevoked(hash('b'))).isTrue();
        assertThat(store.isRevoked(hash('c'))).isFalse();
        // 이미 폐기된 건 사유를 덮어쓰지 않는다
        assertThat(store.findRevocation(hash('a')).orElseThrow().reason()).isEqualTo(RefreshRevokeReason.ROTATED);
    }

    @Test
    @DisplayName("purgeExpired: 자연 만료 지난 엔트리만 제거")
    void purge_removes_only_expired() {
        store.track(hash('a'), OWNER, inDays(1));
        store.track(hash('b'), OWNER, inDays(10));
        store.revoke(hash('a'), OWNER, inDays(1), RefreshRevokeReason.LOGOUT);

        int purged = store.purgeExpired(inDays(2));

        assertThat(purged).isEqualTo(1);
        assertThat(repo.findByTokenHash(hash('a'))).isEmpty();
        assertThat(repo.findByTokenHash(hash('b'))).isPresent();
    }
}
