package com.guestlist.backend.auth.identity.signup.service;

import org.springframework.stereotype.Service;

import com.guestlist.backend.auth.identity.provider.IdentityProvider;
import com.guestlist.backend.auth.identity.provider.UserRecord;
import com.guestlist.backend.auth.session.service.SessionOutcome;
import com.guestlist.backend.auth.session.service.SessionService;
import com.guestlist.backend.global.ApiException;

import lombok.RequiredArgsConstructor;

/**
 * 회원가입 + 바로 로그인
 * - 중복 이메일/이름은 IdentityProvider가 409로 막는다
 * - 가입 직후 세션 발급
 */
@Service
@RequiredArgsConstructor
public class SignupService {

    private final IdentityProvider identityProvider;
    private final SessionService sessionService;

    public SessionOutcome registerAndLogin(String email, String password, String userName) {
        UserRecord user = identityProvider.register(email, password, userName);

        SessionOutcome outcome = sessionService.startSession(user);
        if (!outcome.isSuccess()) {
            throw new ApiException(outcome.failure().sessionStartErrorCode());
        }
        return outcome;
    }
}
