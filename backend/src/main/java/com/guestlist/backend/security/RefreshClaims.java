package com.guestlist.backend.security;

import java.time.Instant;
import java.util.Optional;

import io.jsonwebtoken.Claims;

/**
 * Refresh Token payload: 누구의 토큰인지(userId)와 토큰 고유 id(jti)만 담는다.
 */
public record RefreshClaims(String tokenId, Long userId, Instant issuedAt, Instant expiresAt) {

    public static Optional<RefreshClaims> from(Claims claims) {
        return AccessClaims.parseSubject(claims)
                .map(userId -> new RefreshClaims(
                        claims.getId(),
                        userId,
                        claims.getIssuedAt() == null ? null : claims.getIssuedAt().toInstant(),
                        claims.getExpiration().toInstant()));
    }
}
