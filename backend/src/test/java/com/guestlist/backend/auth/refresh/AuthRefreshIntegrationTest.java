package com.guestlist.backend.auth.refresh;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import com.guestlist.backend.auth.AbstractAuthIntegrationTest;
import com.guestlist.backend.auth.token.domain.RefreshRevokeReason;
import com.guestlist.backend.auth.token.domain.TrackedRefreshToken;
import com.guestlist.backend.global.ErrorCode;
import com.guestlist.backend.support.AuthFlowSupport;
import com.guestlist.backend.support.AuthHttpSupport;
import com.guestlist.backend.support.AuthHttpSupport.SessionCookies;

@DisplayName("[Auth][Refresh] 리프레시 토큰 로테이션 통합 테스트")
class AuthRefreshIntegrationTest extends AbstractAuthIntegrationTest {

    @Autowired MockMvc mvc;

    @Test
    @DisplayName("리프레시: 새 access/refresh 발급 + 기존 refresh는 ROTATED로 폐기")
    void refresh_rotates_token_and_revokes_old() throws Exception {
        SessionCookies login = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD);
        String oldRaw = login.refreshToken();

        SessionCookies refreshed = AuthFlowSupport.refreshOk(mvc, oldRaw);

        assertThat(refreshed.refreshToken()).isNotBlank().isNotEqualTo(oldRaw);
        assertThat(refreshed.accessToken()).isNotBlank();
        assertThat(refreshed.body().get("user").get("id").asLong()).isEqualTo(seededUser.getId());

        TrackedRefreshToken oldRow = refreshTokenRepository.findByTokenHash(tokenHashUtils.sha256Hex(oldRaw)).orElseThrow();
        assertThat(oldRow.isRevoked()).isTrue();
        assertThat(oldRow.getRevokeReason()).isEqualTo(RefreshRevokeReason.ROTATED);

        TrackedRefreshToken newRow = refreshTokenRepository.findByTokenHash(
                tokenHashUtils.sha256Hex(refreshed.refreshToken())).orElseThrow();
        assertThat(newRow.isRevoked()).isFalse();

        // 새 refresh로 한 번 더 rotation 가능
        AuthFlowSupport.refreshOk(mvc, refreshed.refreshToken());
    }

    @Test
    @DisplayName("리프레시: 쿠키 없음 → 401 AUTH_REQUIRED")
    void refresh_without_cookie() throws Exception {
        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performRefresh(mvc, null),
                ErrorCode.AUTH_REQUIRED);
    }

    @Test
    @DisplayName("리프레시: 형식이 깨진 토큰 → 401 REFRESH_INVALID + 쿠키 삭제")
    void refresh_with_garbage_token() throws Exception {
        MvcResult res = AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performRefresh(mvc, "not-a-token"),
                ErrorCode.REFRESH_INVALID);

        List<String> setCookies = res.getResponse().getHeaders(HttpHeaders.SET_COOKIE);
        AuthHttpSupport.assertCookieCleared(setCookies, AuthHttpSupport.ACCESS_COOKIE);
        AuthHttpSupport.assertCookieCleared(setCookies, AuthHttpSupport.REFRESH_COOKIE);
    }

    @Test
    @DisplayName("리프레시: access token을 refresh 자리에 넣으면 → 401 REFRESH_INVALID (서명 키가 다름)")
    void refresh_with_access_token() throws Exception {
        SessionCookies login = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD);

        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performRefresh(mvc, login.accessToken()),
                ErrorCode.REFRESH_INVALID);
    }

    @Test
    @DisplayName("재사용 감지: 이미 ROTATED 된 refresh 재제출 → 401 + 그 유저의 최신 refresh까지 폐기")
    void replay_of_rotated_token_revokes_whole_family() throws Exception {
        SessionCookies login = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD);
        SessionCookies refreshed = AuthFlowSupport.refreshOk(mvc, login.refreshToken());

        // 탈취된 예전 토큰 재사용
        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performRefresh(mvc, login.refreshToken()),
                ErrorCode.REFRESH_INVALID);

        // 정상 사용자의 최신 토큰도 같이 죽는다
        TrackedRefreshToken latest = refreshTokenRepository.findByTokenHash(
                tokenHashUtils.sha256Hex(refreshed.refreshToken())).orElseThrow();
        assertThat(latest.isRevoked()).isTrue();
        assertThat(latest.getRevokeReason()).isEqualTo(RefreshRevokeReason.REUSE_DETECTED);

        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performRefresh(mvc, refreshed.refreshToken()),
                ErrorCode.REFRESH_INVALID);
    }

    @Test
    @DisplayName("리프레시: 사용자 삭제 후 → 401 REFRESH_INVALID")
    void refresh_after_user_deleted() throws Exception {
        SessionCookies login = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD);
        userRepository.deleteAll();

        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performRefresh(mvc, login.refreshToken()),
                ErrorCode.REFRESH_INVALID);
    }

    @Test
    @DisplayName("리프레시 응답: 사용자 상태는 DB 기준 최신값")
    void refresh_returns_current_user_state() throws Exception {
        SessionCookies login = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD);

        AuthHttpSupport.performRefresh(mvc, login.refreshToken())
                .andExpect(jsonPath("$.user.email").value(EMAIL))
                .andExpect(jsonPath("$.user.isAllowed").value(false))
                .andExpect(jsonPath("$.user.roles[0]").value("user"));
    }
}
