package com.guestlist.backend.auth.identity.provider;

import java.util.Optional;

/**
 * 사용자 계정 조회/인증 계약
 *
 * SessionService는 이 인터페이스만 본다. 비밀번호 해싱 방식은 구현체가 알아서 한다.
 */
public interface IdentityProvider {

    Optional<UserRecord> findById(Long id);

    /**
     * 이메일/비밀번호가 맞으면 사용자, 아니면 empty.
     * 없는 이메일인지 틀린 비밀번호인지는 구분하지 않는다.
     */
    Optional<UserRecord> validateCredentials(String email, String password);

    /**
     * 신규 가입
     * @throws com.guestlist.backend.global.ApiException EMAIL_ALREADY_EXISTS / USERNAME_ALREADY_EXISTS
     */
    UserRecord register(String email, String password, String userName);
}
