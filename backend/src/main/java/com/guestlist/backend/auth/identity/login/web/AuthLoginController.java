package com.guestlist.backend.auth.identity.login.web;

import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.guestlist.backend.auth.identity.login.dto.LoginRequest;
import com.guestlist.backend.auth.session.dto.SessionResponse;
import com.guestlist.backend.auth.session.dto.UserView;
import com.guestlist.backend.auth.session.service.SessionOutcome;
import com.guestlist.backend.auth.session.service.SessionService;
import com.guestlist.backend.auth.token.support.AuthCookieUtils;
import com.guestlist.backend.global.ApiException;

import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

/**
 * 로그인 API 컨트롤러
 *
 * - Access / Refresh Token 모두 HttpOnly 쿠키(Set-Cookie)로 반환
 * - body에는 사용자 정보만
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/auth")
public class AuthLoginController {

    private final SessionService sessionService;
    private final AuthCookieUtils cookieUtils;

    /**
     * POST /api/auth/login
     *
     * Request body: { "email": "anna@mail.com", "password": "SecurePass123!" }
     *
     * Response
     * - Set-Cookie: accessToken=...; HttpOnly; ...
     * - Set-Cookie: refreshToken=...; HttpOnly; ...
     * - Body: { "message": "...", "user": { ... } }
     */
    @PostMapping("/login")
    public SessionResponse login(@Valid @RequestBody LoginRequest req, HttpServletResponse response) {
        SessionOutcome outcome = sessionService.login(req.email(), req.password());
        if (!outcome.isSuccess()) {
            throw new ApiException(outcome.failure().sessionStartErrorCode());
        }

        cookieUtils.apply(response, outcome.cookieWrites());
        return SessionResponse.of("로그인되었습니다.", UserView.from(outcome.user()));
    }
}
