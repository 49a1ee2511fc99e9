package com.guestlist.backend.auth.token.repo;

import java.time.LocalDateTime;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.guestlist.backend.auth.token.domain.RefreshRevokeReason;
import com.guestlist.backend.auth.token.domain.TrackedRefreshToken;

public interface TrackedRefreshTokenRepository extends JpaRepository<TrackedRefreshToken, Long> {

    Optional<TrackedRefreshToken> findByTokenHash(String tokenHash);

    /**
     * 조건부 UPDATE (compare-and-set)
     * - revoked_at IS NULL 인 row만 바꾼다 -> 동시에 두 요청이 들어와도 1건만 1을 받는다.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update TrackedRefreshToken t
               set t.revokedAt = :now, t.revokeReason = :reason
             where t.tokenHash = :tokenHash
               and t.revokedAt is null
            """)
    int revokeIfActive(@Param("tokenHash") String tokenHash,
                       @Param("now") LocalDateTime now,
                       @Param("reason") RefreshRevokeReason reason);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update TrackedRefreshToken t
               set t.revokedAt = :now, t.revokeReason = :reason
             where t.userId = :userId
               and t.revokedAt is null
               and t.expiresAt > :now
            """)
    int revokeAllActiveByUserId(@Param("userId") Long userId,
                                @Param("now") LocalDateTime now,
                                @Param("reason") RefreshRevokeReason reason);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from TrackedRefreshToken t where t.expiresAt <= :now")
    int deleteExpired(@Param("now") LocalDateTime now);
}
