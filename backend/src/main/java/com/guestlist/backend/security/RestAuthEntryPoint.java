package com.guestlist.backend.security;

import java.io.IOException;

import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;

import com.guestlist.backend.global.ErrorCode;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 인증이 필요한 엔드포인트(/api/auth/me 등)에 인증 없이 접근했을 때 호출되는 EntryPoint.
 *
 * - Access Token이 아예 없는 경우
 * - access 쿠키가 있었지만 만료/위조라 필터가 그냥 통과시킨 경우
 *
 * Bearer 헤더가 있는데 invalid인 경우는 JwtAuthenticationFilter가 ACCESS_INVALID로 먼저 끊는다.
 */
@Slf4j
@RequiredArgsConstructor
public class RestAuthEntryPoint implements AuthenticationEntryPoint {

    private final SecurityErrorWriter errorWriter;

    @Override
    public void commence(
            HttpServletRequest request,
            HttpServletResponse response,
            AuthenticationException authException) throws IOException {

        log.debug("Unauthenticated {} {}", request.getMethod(), request.getRequestURI());
        errorWriter.write(response, ErrorCode.AUTH_REQUIRED);
    }
}
