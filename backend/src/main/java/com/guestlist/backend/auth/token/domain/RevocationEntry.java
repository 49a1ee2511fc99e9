package com.guestlist.backend.auth.token.domain;

import java.time.Instant;

/**
 * 폐기 기록 (token identity -> 누가, 언제, 왜, 원래 언제 만료될 토큰이었는지)
 * naturalExpiry 이후엔 purge 대상.
 */
public record RevocationEntry(
        String tokenHash,
        Long ownerId,
        Instant revokedAt,
        Instant naturalExpiry,
        RefreshRevokeReason reason
) {}
