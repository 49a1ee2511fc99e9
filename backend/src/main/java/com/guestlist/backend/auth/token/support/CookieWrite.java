package com.guestlist.backend.auth.token.support;

import java.time.Duration;

/**
 * SessionService가 내려주는 "쿠키를 이렇게 써라" 지시.
 * HTTP를 모르는 서비스 계층과 AuthCookieUtils 사이의 경계.
 *
 * - set: value + maxAge(토큰 수명)
 * - clear: 빈 값 + Max-Age=0
 */
public record CookieWrite(CredentialCookie cookie, String value, Duration maxAge) {

    public static CookieWrite set(CredentialCookie cookie, String value, Duration maxAge) {
        return new CookieWrite(cookie, value, maxAge);
    }

    public static CookieWrite clear(CredentialCookie cookie) {
        return new CookieWrite(cookie, "", Duration.ZERO);
    }

    public boolean isClear() {
        return maxAge.isZero();
    }
}
