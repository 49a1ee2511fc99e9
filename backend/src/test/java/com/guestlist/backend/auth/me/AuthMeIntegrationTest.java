package com.guestlist.backend.auth.me;

import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.web.servlet.MockMvc;

import com.guestlist.backend.auth.AbstractAuthIntegrationTest;
import com.guestlist.backend.global.ErrorCode;
import com.guestlist.backend.support.AuthFlowSupport;
import com.guestlist.backend.support.AuthHttpSupport;
import com.guestlist.backend.support.AuthHttpSupport.SessionCookies;

@DisplayName("[Auth][Me] 내 정보 조회 통합 테스트")
class AuthMeIntegrationTest extends AbstractAuthIntegrationTest {

    @Autowired MockMvc mvc;

    @Test
    @DisplayName("access 쿠키로 /me → 200 + 토큰에 실린 사용자 정보")
    void me_with_access_cookie() throws Exception {
        SessionCookies login = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD);

        AuthHttpSupport.performMeWithCookie(mvc, login.accessToken())
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(seededUser.getId().intValue()))
                .andExpect(jsonPath("$.email").value(EMAIL))
                .andExpect(jsonPath("$.userName").value(USER_NAME))
                .andExpect(jsonPath("$.roles[0]").value("user"));
    }

    @Test
    @DisplayName("Authorization: Bearer 로 /me → 200")
    void me_with_bearer_header() throws Exception {
        SessionCookies login = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD);

        AuthHttpSupport.performMeWithBearer(mvc, login.accessToken())
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.email").value(EMAIL));
    }

    @Test
    @DisplayName("토큰 없음 → 401 AUTH_REQUIRED")
    void me_without_token() throws Exception {
        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performMeWithCookie(mvc, null),
                ErrorCode.AUTH_REQUIRED);
    }

    @Test
    @DisplayName("위조 Bearer 토큰 → 401 ACCESS_INVALID")
    void me_with_invalid_bearer() throws Exception {
        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performMeWithBearer(mvc, "aaa.bbb.ccc"),
                ErrorCode.ACCESS_INVALID);
    }

    @Test
    @DisplayName("위조 access 쿠키 → 미인증으로 처리되어 401 AUTH_REQUIRED")
    void me_with_invalid_cookie() throws Exception {
        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performMeWithCookie(mvc, "aaa.bbb.ccc"),
                ErrorCode.AUTH_REQUIRED);
    }

    @Test
    @DisplayName("refresh token을 access 자리에 쓰면 → 401 ACCESS_INVALID")
    void me_with_refresh_token_as_bearer() throws Exception {
        SessionCookies login = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD);

        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performMeWithBearer(mvc, login.refreshToken()),
                ErrorCode.ACCESS_INVALID);
    }

    @Test
    @DisplayName("로그아웃해도 access token은 만료 전까지 유효 (access는 폐기 목록을 보지 않는다)")
    void access_token_survives_logout_until_expiry() throws Exception {
        SessionCookies login = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD);
        AuthFlowSupport.logoutOk(mvc, login.refreshToken());

        AuthHttpSupport.performMeWithBearer(mvc, login.accessToken())
                .andExpect(status().isOk());
    }
}
