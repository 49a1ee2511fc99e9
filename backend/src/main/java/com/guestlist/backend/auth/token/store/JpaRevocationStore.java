package com.guestlist.backend.auth.token.store;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import com.guestlist.backend.auth.config.AuthProperties;
import com.guestlist.backend.auth.token.domain.RefreshRevokeReason;
import com.guestlist.backend.auth.token.domain.RevocationEntry;
import com.guestlist.backend.auth.token.domain.TrackedRefreshToken;
import com.guestlist.backend.auth.token.repo.TrackedRefreshTokenRepository;

import lombok.extern.slf4j.Slf4j;

/**
 * refresh_tokens 테이블 기반 RevocationStore
 *
 * - 폐기는 조건부 UPDATE(revoked_at IS NULL) 한 방으로 처리 -> row 단위 compare-and-set
 * - 추적 기록이 없는 토큰은 폐기 상태 row를 새로 넣는다. 동시에 같은 토큰을 넣으려다 unique 제약에 걸린 쪽은 false.
 * - 모든 메서드는 app.auth.revocation.timeout-seconds 트랜잭션 타임아웃 안에서 돈다.
 *   타임아웃/DB 오류는 그대로 던지고, SessionService가 STORE_UNAVAILABLE로 바꾼다.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "app.auth.revocation", name = "store", havingValue = "jpa", matchIfMissing = true)
public class JpaRevocationStore implements RevocationStore {

    private static final String TIMEOUT = "${app.auth.revocation.timeout-seconds:3}";

    private final TrackedRefreshTokenRepository repo;
    private final Clock clock;
    private final TransactionTemplate revokeTx; // revoke 전용 (unique 충돌은 트랜잭션 밖에서 받는다)

    public JpaRevocationStore(
            TrackedRefreshTokenRepository repo,
            Clock clock,
            PlatformTransactionManager transactionManager,
            AuthProperties props
    ) {
        this.repo = repo;
        this.clock = clock;
        this.revokeTx = new TransactionTemplate(transactionManager);
        this.revokeTx.setTimeout(props.revocation().timeoutSeconds());
    }

    @Override
    @Transactional(timeoutString = TIMEOUT)
    public void track(String tokenHash, Long ownerId, Instant naturalExpiry) {
        repo.save(TrackedRefreshToken.issue(ownerId, tokenHash, now(), toUtc(naturalExpiry)));
    }

    @Override
    @Transactional(readOnly = true, timeoutString = TIMEOUT)
    public boolean isRevoked(String tokenHash) {
        LocalDateTime now = now();
        return repo.findByTokenHash(tokenHash)
                .filter(TrackedRefreshToken::isRevoked)
                .filter(t -> !t.isExpired(now))
                .isPresent();
    }

    @Override
    public boolean revoke(String tokenHash, Long ownerId, Instant naturalExpiry, RefreshRevokeReason reason) {
        try {
            return revokeOnce(tokenHash, ownerId, naturalExpiry, reason);
        } catch (PessimisticLockingFailureException e) {
            // 빈 gap에 대한 동시 UPDATE -> INSERT는 InnoDB에서 deadlock으로 끝날 수 있다. 진 쪽은 한 번만 다시 본다.
            log.debug("Revoke lock conflict for user {}, retrying once", ownerId);
            return revokeOnce(tokenHash, ownerId, naturalExpiry, reason);
        }
    }

    private boolean revokeOnce(String tokenHash, Long ownerId, Instant naturalExpiry, RefreshRevokeReason reason) {
        try {
            return Boolean.TRUE.equals(
                    revokeTx.execute(status -> revokeInTx(tokenHash, ownerId, naturalExpiry, reason)));
        } catch (DataIntegrityViolationException e) {
            // 같은 미추적 토큰을 동시에 폐기한 다른 요청이 먼저 기록했다 -> 이미 폐기됨
            log.debug("Concurrent revoke of untracked refresh token for user {}", ownerId);
            return false;
        }
    }

    private boolean revokeInTx(String tokenHash, Long ownerId, Instant naturalExpiry, RefreshRevokeReason reason) {
        LocalDateTime now = now();

        if (repo.revokeIfActive(tokenHash, now, reason) == 1) {
            return true;
        }
        if (repo.findByTokenHash(tokenHash).isPresent()) {
            return false; // 이미 폐기됨
        }

        // 추적 기록이 없는 토큰 (purge 이후, store 전환 전 발급분 등) -> 폐기 상태로 새로 기록
        log.debug("Revoking untracked refresh token for user {}", ownerId);
        repo.saveAndFlush(TrackedRefreshToken.revokedUntracked(ownerId, tokenHash, now, toUtc(naturalExpiry), reason));
        return true;
    }

    @Override
    @Transactional(timeoutString = TIMEOUT)
    public int revokeAll(Long ownerId, RefreshRevokeReason reason) {
        return repo.revokeAllActiveByUserId(ownerId, now(), reason);
    }

    @Override
    @Transactional(readOnly = true, timeoutString = TIMEOUT)
    public Optional<RevocationEntry> findRevocation(String tokenHash) {
        return repo.findByTokenHash(tokenHash)
                .filter(TrackedRefreshToken::isRevoked)
                .map(t -> new RevocationEntry(
                        t.getTokenHash(),
                        t.getUserId(),
                        t.getRevokedAt().toInstant(ZoneOffset.UTC),
                        t.getExpiresAt().toInstant(ZoneOffset.UTC),
                        t.getRevokeReason()));
    }

    @Override
    @Transactional(timeoutString = TIMEOUT)
    public int purgeExpired(Instant now) {
        return repo.deleteExpired(toUtc(now));
    }

    private LocalDateTime now() {
        return toUtc(clock.instant());
    }

    private static LocalDateTime toUtc(Instant instant) {
        return LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
    }
}
