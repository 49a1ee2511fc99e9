package com.guestlist.backend.security;

import io.jsonwebtoken.Claims;

/**
 * TokenCodec.verify() 결과
 * - 성공: claims != null, failure == null
 * - 실패: claims == null, failure != null
 */
public record TokenVerification(Claims claims, VerificationFailure failure) {

    public static TokenVerification verified(Claims claims) {
        return new TokenVerification(claims, null);
    }

    public static TokenVerification failed(VerificationFailure failure) {
        return new TokenVerification(null, failure);
    }

    public boolean isVerified() {
        return failure == null;
    }
}
