package com.guestlist.backend.security;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

import io.jsonwebtoken.Claims;

/**
 * Access Token에 실리는 사용자 스냅샷
 * - userId: sub
 * - email / userName: 표시용
 * - roles: 비어있을 수 없음
 * - allowed: 서비스 이용 허가 여부
 */
public record AccessClaims(
        Long userId,
        String email,
        String userName,
        Set<String> roles,
        boolean allowed,
        Instant issuedAt,
        Instant expiresAt
) {

    static final String EMAIL_CLAIM = "email";
    static final String USER_NAME_CLAIM = "userName";
    static final String ROLES_CLAIM = "roles";
    static final String ALLOWED_CLAIM = "allowed";

    public AccessClaims {
        roles = Collections.unmodifiableSet(new LinkedHashSet<>(roles)); // 순서 유지
    }

    /**
     * 검증을 통과한 Claims에서 복원. 필수 클레임이 빠져 있으면 empty.
     */
    public static Optional<AccessClaims> from(Claims claims) {
        Optional<Long> userId = parseSubject(claims);
        if (userId.isEmpty()) return Optional.empty();

        String email = claims.get(EMAIL_CLAIM, String.class);
        if (email == null || email.isBlank()) return Optional.empty();

        Set<String> roles = readRoles(claims.get(ROLES_CLAIM));
        if (roles.isEmpty()) return Optional.empty();

        Boolean allowed = claims.get(ALLOWED_CLAIM, Boolean.class);

        return Optional.of(new AccessClaims(
                userId.get(),
                email,
                claims.get(USER_NAME_CLAIM, String.class),
                roles,
                Boolean.TRUE.equals(allowed),
                claims.getIssuedAt() == null ? null : claims.getIssuedAt().toInstant(),
                claims.getExpiration().toInstant()
        ));
    }

    // subject:userId -> Long userId 파싱
    static Optional<Long> parseSubject(Claims claims) {
        String sub = claims.getSubject();
        if (sub == null || sub.isBlank()) return Optional.empty();
        try {
            return Optional.of(Long.valueOf(sub));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static Set<String> readRoles(Object raw) {
        Set<String> roles = new LinkedHashSet<>();
        if (raw instanceof Collection<?> values) {
            for (Object v : values) {
                if (v instanceof String role && !role.isBlank()) roles.add(role);
            }
        }
        return roles;
    }
}
