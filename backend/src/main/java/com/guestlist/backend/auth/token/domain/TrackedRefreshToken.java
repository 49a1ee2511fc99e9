package com.guestlist.backend.auth.token.domain;

import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * [refresh_tokens 테이블 매핑 엔티티]
 *
 * 발급된 refresh token 한 건 = 한 row.
 * - 클라이언트에게는 refresh 원문을 쿠키로 내려주고(HttpOnly)
 * - DB에는 token_hash(sha256)만 저장한다.
 *
 * revoked_at != null 이면 폐기된 토큰. expires_at이 지나면 purge 대상.
 * 시각 컬럼은 모두 UTC 기준 LocalDateTime.
 *
 * @Index: idx_refresh_token_hash (raw -> sha256 -> token_hash로 조회)
 * @Index: idx_refresh_user_id (revokeAll(userId)용)
 */
@Getter
@Entity
@Table(name = "refresh_tokens", indexes = {
    @Index(name = "idx_refresh_token_hash", columnList = "token_hash", unique = true),
    @Index(name = "idx_refresh_user_id", columnList = "user_id")
})
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class TrackedRefreshToken {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "token_hash", nullable = false, unique = true, length = 64, columnDefinition = "char(64)")
    private String tokenHash;

    @Column(name = "expires_at", nullable = false)
    private LocalDateTime expiresAt;

    @Column(name = "revoked_at")
    private LocalDateTime revokedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "revoke_reason", length = 50)
    private RefreshRevokeReason revokeReason;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public static TrackedRefreshToken issue(Long userId, String tokenHash, LocalDateTime now, LocalDateTime expiresAt) {
        TrackedRefreshToken t = new TrackedRefreshToken();
        t.userId = userId;
        t.tokenHash = tokenHash;
        t.expiresAt = expiresAt;
        t.createdAt = now;
        return t;
    }

    // 추적된 적 없는 토큰을 폐기할 때 (서버 재시작 전 발급분 등)
    public static TrackedRefreshToken revokedUntracked(Long userId, String tokenHash, LocalDateTime now,
                                                        LocalDateTime expiresAt, RefreshRevokeReason reason) {
        TrackedRefreshToken t = issue(userId, tokenHash, now, expiresAt);
        t.revokedAt = now;
        t.revokeReason = reason;
        return t;
    }

    public boolean isExpired(LocalDateTime now) {return !expiresAt.isAfter(now);}
    public boolean isRevoked() {return revokedAt != null;}
}
