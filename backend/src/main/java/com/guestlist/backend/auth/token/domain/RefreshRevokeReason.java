package com.guestlist.backend.auth.token.domain;

/**
 * RefreshToken이 폐기(revoke)된 이유
 *
 * - ROTATED: 정상적인 refresh rotation 과정에서 기존 토큰을 폐기한 경우
 * - LOGOUT: 사용자가 로그아웃해서 서버가 세션을 종료한 경우
 * - LOGOUT_ALL: "모든 기기에서 로그아웃"
 * - REUSE_DETECTED: 이미 ROTATED 된 토큰이 다시 제출되어 해당 유저의 세션을 전부 끊은 경우
 */
public enum RefreshRevokeReason {
    ROTATED,
    LOGOUT,
    LOGOUT_ALL,
    REUSE_DETECTED
}
