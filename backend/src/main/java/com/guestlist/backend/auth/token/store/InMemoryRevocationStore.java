package com.guestlist.backend.auth.token.store;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import com.guestlist.backend.auth.token.domain.RefreshRevokeReason;
import com.guestlist.backend.auth.token.domain.RevocationEntry;

import lombok.RequiredArgsConstructor;

/**
 * 메모리 기반 RevocationStore (단일 인스턴스용)
 *
 * - tokens: token identity -> 상태
 * - tokensByOwner: userId -> token identity 집합 (revokeAll용 인덱스)
 *
 * 전역 락 없음. 같은 키에 대한 전이는 ConcurrentHashMap.compute 안에서만 일어난다.
 * 재시작하면 기록이 사라진다.
 */
@Component
@ConditionalOnProperty(prefix = "app.auth.revocation", name = "store", havingValue = "memory")
@RequiredArgsConstructor
public class InMemoryRevocationStore implements RevocationStore {

    private final Clock clock;

    private final Map<String, TokenState> tokens = new ConcurrentHashMap<>();
    private final Map<Long, Set<String>> tokensByOwner = new ConcurrentHashMap<>();

    @Override
    public void track(String tokenHash, Long ownerId, Instant naturalExpiry) {
        tokens.putIfAbsent(tokenHash, TokenState.active(ownerId, naturalExpiry));
        index(ownerId, tokenHash);
    }

    @Override
    public boolean isRevoked(String tokenHash) {
        TokenState state = tokens.get(tokenHash);
        return state != null && state.isRevoked() && clock.instant().isBefore(state.naturalExpiry());
    }

    @Override
    public boolean revoke(String tokenHash, Long ownerId, Instant naturalExpiry, RefreshRevokeReason reason) {
        Instant now = clock.instant();
        AtomicBoolean transitioned = new AtomicBoolean(false);

        tokens.compute(tokenHash, (hash, current) -> {
            if (current == null) {
                transitioned.set(true);
                return TokenState.active(ownerId, naturalExpiry).revoke(now, reason);
            }
            if (current.isRevoked()) {
                return current;
            }
            transitioned.set(true);
            return current.revoke(now, reason);
        });

        index(ownerId, tokenHash);
        return transitioned.get();
    }

    @Override
    public int revokeAll(Long ownerId, RefreshRevokeReason reason) {
        Set<String> owned = tokensByOwner.get(ownerId);
        if (owned == null) return 0;

        Instant now = clock.instant();
        int revoked = 0;
        for (String hash : List.copyOf(owned)) {
            AtomicBoolean transitioned = new AtomicBoolean(false);
            tokens.computeIfPresent(hash, (k, current) -> {
                if (current.isRevoked() || !now.isBefore(current.naturalExpiry())) {
                    return current;
                }
                transitioned.set(true);
                return current.revoke(now, reason);
            });
            if (transitioned.get()) revoked++;
        }
        return revoked;
    }

    @Override
    public Optional<RevocationEntry> findRevocation(String tokenHash) {
        TokenState state = tokens.get(tokenHash);
        if (state == null || !state.isRevoked()) return Optional.empty();
        return Optional.of(new RevocationEntry(
                tokenHash, state.ownerId(), state.revokedAt(), state.naturalExpiry(), state.reason()));
    }

    @Override
    public int purgeExpired(Instant now) {
        int purged = 0;
        for (Map.Entry<String, TokenState> e : tokens.entrySet()) {
            TokenState state = e.getValue();
            if (now.isBefore(state.naturalExpiry())) continue;
            if (tokens.remove(e.getKey(), state)) {
                unindex(state.ownerId(), e.getKey());
                purged++;
            }
        }
        return purged;
    }

    private void index(Long ownerId, String tokenHash) {
        tokensByOwner.compute(ownerId, (owner, hashes) -> {
            Set<String> set = hashes != null ? hashes : ConcurrentHashMap.newKeySet();
            set.add(tokenHash);
            return set;
        });
    }

    private void unindex(Long ownerId, String tokenHash) {
        tokensByOwner.computeIfPresent(ownerId, (owner, hashes) -> {
            hashes.remove(tokenHash);
            return hashes.isEmpty() ? null : hashes;
        });
    }

    private record TokenState(Long ownerId, Instant naturalExpiry, Instant revokedAt, RefreshRevokeReason reason) {

        static TokenState active(Long ownerId, Instant naturalExpiry) {
            return new TokenState(ownerId, naturalExpiry, null, null);
        }

        boolean isRevoked() {
            return revokedAt != null;
        }

        TokenState revoke(Instant now, RefreshRevokeReason reason) {
            return new TokenState(ownerId, naturalExpiry, now, reason);
        }
    }
}
