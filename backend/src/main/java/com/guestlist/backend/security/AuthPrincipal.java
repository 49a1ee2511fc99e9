package com.guestlist.backend.security;

import java.util.Set;

/**
 * 인증 완료 후 SecurityContext에 올릴 "로그인 사용자 정보" 모델
 *
 * JwtAuthenticationFilter에서 Access Token 검증 성공 시 AccessClaims로부터 만든다.
 */
public record AuthPrincipal(Long userId, String email, String userName, Set<String> roles, boolean allowed) {

    public static AuthPrincipal from(AccessClaims claims) {
        return new AuthPrincipal(
                claims.userId(),
                claims.email(),
                claims.userName(),
                claims.roles(),
                claims.allowed());
    }
}
