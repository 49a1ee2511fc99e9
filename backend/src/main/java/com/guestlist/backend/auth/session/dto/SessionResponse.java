package com.guestlist.backend.auth.session.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * login / register / refresh 응답 body
 * - 토큰은 body에 싣지 않는다. (HttpOnly 쿠키로만)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionResponse(String message, UserView user) {

    public static SessionResponse of(String message, UserView user) {
        return new SessionResponse(message, user);
    }

    public static SessionResponse of(UserView user) {
        return new SessionResponse(null, user);
    }
}
