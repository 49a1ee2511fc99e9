package com.guestlist.backend.auth.session.dto;

import java.util.Set;

import com.guestlist.backend.auth.identity.provider.UserRecord;
import com.guestlist.backend.security.AuthPrincipal;

/**
 * 응답에 내려주는 사용자 정보
 * { "id": 1, "email": "...", "userName": "...", "isAllowed": false, "roles": ["user"] }
 */
public record UserView(Long id, String email, String userName, boolean isAllowed, Set<String> roles) {

    public static UserView from(UserRecord user) {
        return new UserView(user.id(), user.email(), user.userName(), user.allowed(), user.roles());
    }

    public static UserView from(AuthPrincipal principal) {
        return new UserView(principal.userId(), principal.email(), principal.userName(), principal.allowed(), principal.roles());
    }
}
