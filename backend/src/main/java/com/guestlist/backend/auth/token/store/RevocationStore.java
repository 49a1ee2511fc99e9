package com.guestlist.backend.auth.token.store;

import java.time.Instant;
import java.util.Optional;

import com.guestlist.backend.auth.token.domain.RefreshRevokeReason;
import com.guestlist.backend.auth.token.domain.RevocationEntry;

/**
 * Refresh Token 폐기 목록 저장소
 *
 * 키는 token identity (refresh 원문의 sha256 hex). 원문은 저장하지 않는다.
 * 같은 token identity에 대해서는 read-after-write 일관성을 보장해야 한다.
 *
 * 구현체:
 * - JpaRevocationStore (기본, refresh_tokens 테이블)
 * - InMemoryRevocationStore (app.auth.revocation.store=memory, 단일 인스턴스/테스트용)
 */
public interface RevocationStore {

    /**
     * 발급된 토큰을 기록한다. revokeAll(owner)이 "그 유저의 모든 토큰"을 찾을 수 있게.
     */
    void track(String tokenHash, Long ownerId, Instant naturalExpiry);

    /**
     * 자연 만료 전에 명시적으로 폐기된 토큰이면 true.
     * 모르는 토큰, 자연 만료된 토큰은 false.
     */
    boolean isRevoked(String tokenHash);

    /**
     * 폐기 (멱등)
     * @return 이번 호출이 실제로 "활성 -> 폐기" 전이를 일으켰으면 true, 이미 폐기돼 있었으면 false
     */
    boolean revoke(String tokenHash, Long ownerId, Instant naturalExpiry, RefreshRevokeReason reason);

    /**
     * owner의 추적 중이고 아직 만료 안 된 토큰을 전부 폐기
     * @return 새로 폐기된 건수
     */
    int revokeAll(Long ownerId, RefreshRevokeReason reason);

    /**
     * 폐기 기록 조회 (폐기 사유 확인용). 폐기 안 된 토큰이면 empty.
     */
    Optional<RevocationEntry> findRevocation(String tokenHash);

    /**
     * natural expiry가 now 이전(이하)인 엔트리 제거
     * @return 제거 건수
     */
    int purgeExpired(Instant now);
}
