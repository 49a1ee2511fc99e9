package com.guestlist.backend.security;

import java.time.Instant;

/**
 * 발급된 토큰 원문 + 발급/만료 시각
 */
public record MintedToken(String value, Instant issuedAt, Instant expiresAt) {}
