package com.guestlist.backend.auth.identity.signup.web;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import com.guestlist.backend.auth.identity.signup.dto.SignupRequest;
import com.guestlist.backend.auth.identity.signup.service.SignupService;
import com.guestlist.backend.auth.session.dto.SessionResponse;
import com.guestlist.backend.auth.session.dto.UserView;
import com.guestlist.backend.auth.session.service.SessionOutcome;
import com.guestlist.backend.auth.token.support.AuthCookieUtils;

import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/auth")
public class AuthSignupController {

    private final SignupService signupService;
    private final AuthCookieUtils cookieUtils;

    // 회원가입 완료 -> 201 Created + 세션 쿠키
    @PostMapping("/register")
    @ResponseStatus(HttpStatus.CREATED)
    public SessionResponse register(@Valid @RequestBody SignupRequest req, HttpServletResponse response) {
        SessionOutcome outcome = signupService.registerAndLogin(req.email(), req.password(), req.userName());

        cookieUtils.apply(response, outcome.cookieWrites());
        return SessionResponse.of("회원가입이 완료되었습니다.", UserView.from(outcome.user()));
    }
}
