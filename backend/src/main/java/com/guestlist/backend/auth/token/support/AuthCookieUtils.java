package com.guestlist.backend.auth.token.support;

import java.util.Arrays;
import java.util.List;

import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;

import com.guestlist.backend.auth.config.AuthProperties;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;

/**
 * Access / Refresh 쿠키 유틸 (Transport Adapter)
 *
 * - 두 토큰 모두 "HttpOnly 쿠키"로 내려서 JS에서 접근 못하게 한다. (XSS 방어)
 * - 쿠키 옵션(path/samesite/secure/maxAge)을 한 곳에서 통일해서 관리
 *
 * ResponseCookie
 * - Spring이 제공하는 "Set-Cookie 헤더" 문자열 생성기
 */
@Component
@RequiredArgsConstructor
public class AuthCookieUtils {

    private final AuthProperties props;

    public String readAccessCookie(HttpServletRequest request) {
        return read(request, props.cookie().accessName());
    }

    public String readRefreshCookie(HttpServletRequest request) {
        return read(request, props.cookie().refreshName());
    }

    // 쿠키 쓰기 지시들을 Set-Cookie 헤더로 반영
    public void apply(HttpServletResponse response, List<CookieWrite> writes) {
        for (CookieWrite write : writes) {
            response.addHeader(HttpHeaders.SET_COOKIE, toResponseCookie(write).toString());
        }
    }

    // 두 쿠키 모두 즉시 만료
    public void clearAll(HttpServletResponse response) {
        apply(response, List.of(
                CookieWrite.clear(CredentialCookie.ACCESS),
                CookieWrite.clear(CredentialCookie.REFRESH)));
    }

    ResponseCookie toResponseCookie(CookieWrite write) {
        var c = props.cookie();
        return ResponseCookie
                .from(nameOf(write.cookie()), write.value())
                .httpOnly(true)
                .secure(c.secure())
                .path(c.path())
                .sameSite(c.sameSite())
                .maxAge(write.maxAge())
                .build();
    }

    private String nameOf(CredentialCookie cookie) {
        return switch (cookie) {
            case ACCESS -> props.cookie().accessName();
            case REFRESH -> props.cookie().refreshName();
        };
    }

    private static String read(HttpServletRequest request, String name) {
        Cookie[] cookies = request.getCookies();
        if (cookies == null)
            return null;

        return Arrays.stream(cookies)
                .filter(cookie -> name.equals(cookie.getName()))
                .map(Cookie::getValue)
                .filter(value -> value != null && !value.isBlank())
                .findFirst()
                .orElse(null);
    }
}
