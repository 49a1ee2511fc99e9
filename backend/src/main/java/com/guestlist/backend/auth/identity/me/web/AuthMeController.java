package com.guestlist.backend.auth.identity.me.web;

import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.guestlist.backend.auth.session.dto.UserView;
import com.guestlist.backend.security.AuthPrincipal;

// access token에 실린 사용자 스냅샷을 그대로 돌려준다 (DB 조회 없음)
@RestController
@RequestMapping("/api/auth")
public class AuthMeController {

    @GetMapping("/me")
    public UserView me(@AuthenticationPrincipal AuthPrincipal principal) {
        return UserView.from(principal);
    }
}
