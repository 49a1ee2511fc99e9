package com.guestlist.backend.security;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.guestlist.backend.global.ApiError;
import com.guestlist.backend.global.ErrorCode;

import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;

/**
 * 필터 단계(컨트롤러 도달 전)에서 ApiError JSON을 직접 써주는 헬퍼
 * - RestAuthEntryPoint: AUTH_REQUIRED
 * - JwtAuthenticationFilter: ACCESS_INVALID (Bearer 토큰 불량)
 */
@Component
@RequiredArgsConstructor
public class SecurityErrorWriter {

    private final ObjectMapper objectMapper;

    public void write(HttpServletResponse response, ErrorCode errorCode) throws IOException {
        // 이미 다른 필터가 응답을 만들어버린 경우라면 건드리지 않음
        if (response.isCommitted())
            return;

        response.setStatus(errorCode.status().value());
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setHeader(HttpHeaders.CACHE_CONTROL, "no-store"); // 인증 실패 응답은 캐시 금지

        objectMapper.writeValue(response.getWriter(), ApiError.of(errorCode));
    }
}
