package com.guestlist.backend.auth.token.support;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import com.guestlist.backend.support.TestAuthProperties;

import jakarta.servlet.http.Cookie;

@DisplayName("[Cookie] AuthCookieUtils")
class AuthCookieUtilsTest {

    private final AuthCookieUtils cookieUtils = new AuthCookieUtils(TestAuthProperties.defaults());

    @Test
    @DisplayName("set: HttpOnly, Path=/, SameSite=Lax, Max-Age=토큰 수명")
    void set_cookie_attributes() {
        ResponseCookie cookie = cookieUtils.toResponseCookie(
                CookieWrite.set(CredentialCookie.REFRESH, "r-token", Duration.ofDays(7)));

        assertThat(cookie.getName()).isEqualTo("refreshToken");
        assertThat(cookie.getValue()).isEqualTo("r-token");
        assertThat(cookie.isHttpOnly()).isTrue();
        assertThat(cookie.getPath()).isEqualTo("/");
        assertThat(cookie.getSameSite()).isEqualTo("Lax");
        assertThat(cookie.getMaxAge()).isEqualTo(Duration.ofDays(7));
        assertThat(cookie.isSecure()).isFalse(); // 테스트 설정은 secure=false
    }

    @Test
    @DisplayName("clearAll: 두 쿠키 모두 빈 값 + Max-Age=0")
    void clear_all() {
        MockHttpServletResponse response = new MockHttpServletResponse();

        cookieUtils.clearAll(response);

        assertThat(response.getHeaders(HttpHeaders.SET_COOKIE))
                .hasSize(2)
                .anySatisfy(h -> assertThat(h).startsWith("accessToken=;").contains("Max-Age=0"))
                .anySatisfy(h -> assertThat(h).startsWith("refreshToken=;").contains("Max-Age=0"));
    }

    @Test
    @DisplayName("read: 이름이 맞는 쿠키 값, 없거나 비어 있으면 null")
    void read_cookies() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.setCookies(new Cookie("accessToken", "a-token"), new Cookie("refreshToken", ""));

        assertThat(cookieUtils.readAccessCookie(request)).isEqualTo("a-token");
        assertThat(cookieUtils.readRefreshCookie(request)).isNull();
        assertThat(cookieUtils.readAccessCookie(new MockHttpServletRequest())).isNull();
    }
}
