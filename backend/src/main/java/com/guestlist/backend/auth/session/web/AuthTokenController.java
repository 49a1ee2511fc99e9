package com.guestlist.backend.auth.session.web;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.guestlist.backend.auth.session.dto.SessionResponse;
import com.guestlist.backend.auth.session.dto.UserView;
import com.guestlist.backend.auth.session.service.SessionOutcome;
import com.guestlist.backend.auth.session.service.SessionService;
import com.guestlist.backend.auth.token.support.AuthCookieUtils;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/auth")
public class AuthTokenController {

    private final SessionService sessionService;
    private final AuthCookieUtils cookieUtils;

    /**
     * POST /api/auth/refresh
     * - refresh 쿠키로 rotation 수행 -> 새 access/refresh 쿠키 + { user }
     * - 실패 시 두 쿠키를 지우고 401
     */
    @PostMapping("/refresh")
    public ResponseEntity<?> refresh(HttpServletRequest request, HttpServletResponse response) {
        SessionOutcome outcome = sessionService.refresh(cookieUtils.readRefreshCookie(request));
        cookieUtils.apply(response, outcome.cookieWrites());

        if (!outcome.isSuccess()) {
            return SessionResponses.failure(outcome.failure());
        }
        return ResponseEntity.ok(SessionResponse.of(UserView.from(outcome.user())));
    }
}
