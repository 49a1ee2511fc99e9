package com.guestlist.backend.auth.session.service;

import java.util.List;

import com.guestlist.backend.auth.identity.provider.UserRecord;
import com.guestlist.backend.auth.token.support.CookieWrite;
import com.guestlist.backend.security.MintedToken;

/**
 * SessionService 연산 결과
 *
 * - 성공: failure == null. login/refresh면 user와 새 토큰이 채워진다. logout이면 둘 다 null.
 * - 실패: failure != null
 * - cookieWrites: 성공/실패와 무관하게 컨트롤러가 그대로 Set-Cookie로 반영한다.
 */
public record SessionOutcome(
        AuthFailure failure,
        UserRecord user,
        MintedToken accessToken,
        MintedToken refreshToken,
        List<CookieWrite> cookieWrites
) {

    public SessionOutcome {
        cookieWrites = List.copyOf(cookieWrites);
    }

    static SessionOutcome issued(UserRecord user, MintedToken access, MintedToken refresh, List<CookieWrite> writes) {
        return new SessionOutcome(null, user, access, refresh, writes);
    }

    static SessionOutcome ended(List<CookieWrite> writes) {
        return new SessionOutcome(null, null, null, null, writes);
    }

    static SessionOutcome failed(AuthFailure failure, List<CookieWrite> writes) {
        return new SessionOutcome(failure, null, null, null, writes);
    }

    public boolean isSuccess() {
        return failure == null;
    }
}
