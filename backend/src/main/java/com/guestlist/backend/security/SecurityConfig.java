package com.guestlist.backend.security;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

import com.guestlist.backend.auth.token.support.AuthCookieUtils;

import lombok.RequiredArgsConstructor;

/**
 * Spring Security 전역 보안 설정
 *
 * - 모든 HTTP 요청은 컨트롤러에 도달하기 전에 Security Filter Chain을 먼저 통과한다.
 * - 서버 세션은 쓰지 않는다. 로그인 상태는 access/refresh 토큰 쿠키로만 유지.
 */
@Configuration
@RequiredArgsConstructor
public class SecurityConfig {

    private final JwtService jwtService;
    private final AuthCookieUtils cookieUtils;
    private final SecurityErrorWriter errorWriter;

    @Bean
    SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        return http
                .csrf(csrf -> csrf.disable()) // SameSite 쿠키 + JSON API
                .httpBasic(b -> b.disable())
                .formLogin(f -> f.disable())
                .logout(l -> l.disable()) // /api/auth/logout은 우리 컨트롤러가 처리
                .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))

                // 인증이 안 된 상태로 보호된 리소스 접근 시 401 JSON
                .exceptionHandling(eh -> eh
                        .authenticationEntryPoint(new RestAuthEntryPoint(errorWriter))
                )

                .addFilterBefore(
                        new JwtAuthenticationFilter(jwtService, cookieUtils, errorWriter),
                        UsernamePasswordAuthenticationFilter.class
                )

                .authorizeHttpRequests(auth -> auth
                        .requestMatchers("/error").permitAll()

                        // 공개 auth 엔드포인트
                        .requestMatchers(HttpMethod.POST,
                                "/api/auth/register",
                                "/api/auth/login",
                                "/api/auth/refresh",
                                "/api/auth/logout",
                                "/api/auth/logout-all").permitAll()

                        // 나머지는 인증 필요 (/api/auth/me 포함)
                        .anyRequest().authenticated()
                )
                .build();
    }
}
