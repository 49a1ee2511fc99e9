package com.guestlist.backend.security;

/**
 * 토큰 검증 실패 종류 (로그/진단용으로만 세분화)
 * - MALFORMED: 구조 파싱 불가 (header.payload.signature 형식 아님, 필수 클레임 누락 등)
 * - SIGNATURE_INVALID: 서명 불일치 (다른 secret으로 서명됐거나 변조)
 * - EXPIRED: now >= exp
 */
public enum VerificationFailure {
    MALFORMED,
    SIGNATURE_INVALID,
    EXPIRED
}
