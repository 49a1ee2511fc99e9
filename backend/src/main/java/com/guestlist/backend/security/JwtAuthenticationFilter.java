package com.guestlist.backend.security;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.web.filter.OncePerRequestFilter;

import com.guestlist.backend.auth.token.support.AuthCookieUtils;
import com.guestlist.backend.global.ErrorCode;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Security Filter Chain에서 동작하는 Access Token 인증 필터
 *
 * - Authorization: Bearer <token> 헤더, 없으면 access 쿠키에서 토큰을 꺼낸다.
 * - JwtService로 검증해서 AuthPrincipal을 얻는다.
 * - Authentication 객체를 만들어 SecurityContext에 넣는다.
 *
 * 주의:
 * - "토큰이 없는 요청"은 여기서 막지 않는다. (SecurityConfig의 authorize 규칙과 EntryPoint 담당)
 * - Bearer 토큰이 invalid면 여기서 401 ACCESS_INVALID를 직접 내려준다.
 * - 쿠키 토큰이 invalid면 미인증 상태로 통과시킨다. (만료된 access 쿠키를 들고 /refresh를 부를 수 있어야 하므로)
 */
@Slf4j
@RequiredArgsConstructor
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final String BEARER_PREFIX = "Bearer ";
    private static final String ROLE_PREFIX = "ROLE_";

    private final JwtService jwtService;
    private final AuthCookieUtils cookieUtils;
    private final SecurityErrorWriter errorWriter;

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {

        // 이미 앞단에서 인증이 되어 있으면 그냥 패스
        if (SecurityContextHolder.getContext().getAuthentication() != null) {
            filterChain.doFilter(request, response);
            return;
        }

        String bearer = resolveBearerToken(request);
        String token = bearer != null ? bearer : cookieUtils.readAccessCookie(request);
        if (token == null) {
            filterChain.doFilter(request, response);
            return;
        }

        Optional<AccessClaims> claims = authenticate(token);
        if (claims.isEmpty()) {
            SecurityContextHolder.clearContext();
            if (bearer != null) {
                errorWriter.write(response, ErrorCode.ACCESS_INVALID);
                return;
            }
            filterChain.doFilter(request, response);
            return;
        }

        AuthPrincipal principal = AuthPrincipal.from(claims.get());

        // Spring Security 권한 모델로 변환 (ROLE_ 접두사 관례)
        List<SimpleGrantedAuthority> authorities = principal.roles().stream()
                .map(role -> role.startsWith(ROLE_PREFIX) ? role : ROLE_PREFIX + role)
                .map(SimpleGrantedAuthority::new)
                .toList();

        var authentication = new UsernamePasswordAuthenticationToken(principal, null, authorities);
        authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
        SecurityContextHolder.getContext().setAuthentication(authentication);

        filterChain.doFilter(request, response);
    }

    private Optional<AccessClaims> authenticate(String token) {
        TokenVerification verification = jwtService.verifyAccessToken(token);
        if (!verification.isVerified()) {
            log.debug("Access token rejected: {}", verification.failure());
            return Optional.empty();
        }
        return AccessClaims.from(verification.claims());
    }

    /**
     * Authorization 헤더에서 Bearer 토큰만 뽑아내는 헬퍼.
     * 없거나 형식이 다르면 null 리턴.
     */
    private String resolveBearerToken(HttpServletRequest request) {
        String authHeader = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authHeader == null || authHeader.isBlank())
            return null;
        if (!authHeader.startsWith(BEARER_PREFIX))
            return null;

        String token = authHeader.substring(BEARER_PREFIX.length()).trim();
        return token.isBlank() ? null : token;
    }
}
