package com.guestlist.backend.auth.signup;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import com.guestlist.backend.auth.AbstractAuthIntegrationTest;
import com.guestlist.backend.global.ErrorCode;
import com.guestlist.backend.support.AuthFlowSupport;
import com.guestlist.backend.support.AuthHttpSupport;
import com.guestlist.backend.support.AuthHttpSupport.SessionCookies;

@DisplayName("[Auth][Register] 회원가입 통합 테스트")
class AuthSignupIntegrationTest extends AbstractAuthIntegrationTest {

    @Autowired MockMvc mvc;

    @Test
    @DisplayName("가입 성공: 201 + 세션 쿠키 + 이메일 소문자/이름 trim 저장")
    void register_success_starts_session() throws Exception {
        MvcResult res = AuthHttpSupport.performRegister(mvc, "  NewUser@Mail.com ", "SecurePass123!", "  newuser  ")
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.user.email").value("newuser@mail.com"))
                .andExpect(jsonPath("$.user.userName").value("newuser"))
                .andExpect(jsonPath("$.message").isNotEmpty())
                .andReturn();

        SessionCookies cookies = AuthHttpSupport.readSessionCookies(res);
        assertThat(cookies.accessToken()).isNotBlank();
        assertThat(cookies.refreshToken()).isNotBlank();

        assertThat(userRepository.existsByEmail("newuser@mail.com")).isTrue();

        // 가입한 계정으로 바로 로그인 가능
        AuthFlowSupport.loginOk(mvc, "newuser@mail.com", "SecurePass123!");
    }

    @Test
    @DisplayName("이미 있는 이메일 → 409 EMAIL_ALREADY_EXISTS")
    void register_duplicate_email() throws Exception {
        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performRegister(mvc, EMAIL.toUpperCase(), "SecurePass123!", "someoneElse"),
                ErrorCode.EMAIL_ALREADY_EXISTS);
    }

    @Test
    @DisplayName("이미 있는 사용자 이름 → 409 USERNAME_ALREADY_EXISTS")
    void register_duplicate_user_name() throws Exception {
        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performRegister(mvc, "other@mail.com", "SecurePass123!", USER_NAME),
                ErrorCode.USERNAME_ALREADY_EXISTS);
    }

    @Test
    @DisplayName("짧은 비밀번호 / 잘못된 이메일 / 빈 이름 → 400 VALIDATION_ERROR")
    void register_validation_errors() throws Exception {
        AuthHttpSupport.performRegister(mvc, "test@mail.com", "123", "user")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value(ErrorCode.VALIDATION_ERROR.name()));

        AuthHttpSupport.performRegister(mvc, "invalid-email", "SecurePass123!", "user")
                .andExpect(status().isBadRequest());

        AuthHttpSupport.performRegister(mvc, "test@mail.com", "SecurePass123!", "   ")
                .andExpect(status().isBadRequest());
    }
}
