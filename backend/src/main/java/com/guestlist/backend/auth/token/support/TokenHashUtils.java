package com.guestlist.backend.auth.token.support;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

import org.springframework.stereotype.Component;

/**
 * 토큰 해시 유틸 (token identity)
 *
 * - refresh token "원문"이 저장되면 유출 시 바로 악용 가능
 * - 그래서 RevocationStore에는 "해시(token_hash)"만 키로 쓴다
 *   : incoming raw token -> (sha256Hex) -> store 조회
 */
@Component
public class TokenHashUtils {

    public String sha256Hex(String raw) {
        if (raw == null) throw new IllegalArgumentException("raw token must not be null");
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(raw.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // SHA-256이 없으면 시스템이 정상 동작 불가 수준
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
