package com.guestlist.backend.auth.token.support;

import java.security.SecureRandom;
import java.util.Base64;

import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;

/**
 * 토큰 id(jti) 생성기
 *
 * - 같은 초에 같은 사용자에게 발급된 refresh token도 서로 다른 문자열이 되도록 넣는 랜덤 값
 * - SecureRandom + Base64 URL-safe(패딩 제거)
 */
@Component
@RequiredArgsConstructor
public class TokenGenerator {

    private static final int TOKEN_ID_BYTES = 16;

    private final SecureRandom secureRandom;

    public String generateTokenId() {
        byte[] bytes = new byte[TOKEN_ID_BYTES];
        secureRandom.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
