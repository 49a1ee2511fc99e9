package com.guestlist.backend.auth.session.web;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.guestlist.backend.auth.session.service.SessionOutcome;
import com.guestlist.backend.auth.session.service.SessionService;
import com.guestlist.backend.auth.token.support.AuthCookieUtils;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;

/**
 * 로그아웃
 * - 서버 쪽 refresh 토큰 revoke + 클라이언트 쿠키 삭제
 * - 같은 토큰으로 여러 번 호출해도 성공 (멱등)
 * - 쿠키는 성공/실패와 무관하게 항상 지운다
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/auth")
public class AuthLogoutController {

    private final SessionService sessionService;
    private final AuthCookieUtils cookieUtils;

    @PostMapping("/logout")
    public ResponseEntity<?> logout(HttpServletRequest request, HttpServletResponse response) {
        return respond(sessionService.logout(cookieUtils.readRefreshCookie(request)), response);
    }

    // 모든 기기에서 로그아웃
    @PostMapping("/logout-all")
    public ResponseEntity<?> logoutAll(HttpServletRequest request, HttpServletResponse response) {
        return respond(sessionService.logoutEverywhere(cookieUtils.readRefreshCookie(request)), response);
    }

    private ResponseEntity<?> respond(SessionOutcome outcome, HttpServletResponse response) {
        cookieUtils.apply(response, outcome.cookieWrites());
        if (!outcome.isSuccess()) {
            return SessionResponses.failure(outcome.failure());
        }
        return ResponseEntity.noContent().build();
    }
}
