package com.guestlist.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;
import org.springframework.context.annotation.Import;

import com.guestlist.backend.auth.config.AuthModuleConfig;

/*
[로컬 확인]
curl -i -X POST "http://localhost:8080/api/auth/register" \
  -H "Content-Type: application/json" -c /tmp/guestlist_cookie.txt \
  -d '{"email":"anna@mail.com","password":"SecurePass123!","userName":"anna"}'

curl -i -X GET "http://localhost:8080/api/auth/me" -b /tmp/guestlist_cookie.txt

curl -i -X POST "http://localhost:8080/api/auth/refresh" \
  -b /tmp/guestlist_cookie.txt -c /tmp/guestlist_cookie.txt

curl -i -X POST "http://localhost:8080/api/auth/logout" \
  -b /tmp/guestlist_cookie.txt -c /tmp/guestlist_cookie.txt
*/

/**
 * 설정 값 주입 흐름: 환경변수 -> application.yml(${ENV:default}) -> @ConfigurationProperties(AuthProperties)
 *
 * - AuthProperties는 @Validated라 값이 빠지거나 정책 위반이면 부팅 실패 (Fail-fast)
 * - UserDetailsService 자동설정은 끈다. (기본 인메모리 유저 생성 방지, 인증은 JWT 쿠키로만)
 */
@Import(AuthModuleConfig.class)
@SpringBootApplication(exclude = {UserDetailsServiceAutoConfiguration.class})
public class BackendApplication {
    public static void main(String[] args) {
        SpringApplication.run(BackendApplication.class, args);
    }
}
