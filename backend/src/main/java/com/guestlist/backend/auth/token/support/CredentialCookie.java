package com.guestlist.backend.auth.token.support;

/**
 * 세션이 다루는 두 쿠키. 실제 이름은 app.auth.cookie.* 설정에서 온다.
 */
public enum CredentialCookie {
    ACCESS,
    REFRESH
}
