package com.guestlist.backend.security;

import java.nio.charset.StandardCharsets;

import javax.crypto.SecretKey;

import io.jsonwebtoken.security.Keys;

/**
 * 토큰 종류(access/refresh)별 HMAC 서명 키
 *
 * - tokenType: 토큰 안에 "token_type" 클레임으로 박히고, 검증 시 일치 여부를 다시 확인한다.
 * - key: HS256 서명/검증용 SecretKey (32바이트 이상)
 */
public record SigningKey(String tokenType, SecretKey key) {

    private static final int MIN_SECRET_BYTES = 32;

    public static SigningKey hmac(String tokenType, String secret) {
        if (tokenType == null || tokenType.isBlank()) {
            throw new IllegalArgumentException("tokenType must not be blank");
        }
        byte[] secretBytes = secret == null ? new byte[0] : secret.getBytes(StandardCharsets.UTF_8);
        if (secretBytes.length < MIN_SECRET_BYTES) {
            throw new IllegalStateException(
                    tokenType + " secret must be at least " + MIN_SECRET_BYTES + " bytes for HS256");
        }
        return new SigningKey(tokenType, Keys.hmacShaKeyFor(secretBytes));
    }

    // 키 material이 로그에 찍히지 않도록
    @Override
    public String toString() {
        return "SigningKey[" + tokenType + "]";
    }
}
