package com.guestlist.backend.auth.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;


/**
 * @ConfigurationProperties(prefix = "app.auth"):
 * application.yml 의 app.auth.* 값을 타입 안정성 있게 바인딩해준다.
 * 
 * @Validated 이므로 값이 빠지거나 정책 위반이면 "부팅 실패"로 즉시 터진다. (Fail-fast)
 */
@Validated
@ConfigurationProperties(prefix = "app.auth")
public record AuthProperties(
        @Valid @NotNull Jwt jwt,
        @Valid @NotNull Cookie cookie,
        @Valid @NotNull Revocation revocation
) {

    /**
     * 토큰(JWT) 관련 설정 (referenced by JwtService)
     * - issuer: 토큰 발급자 식별자 (guestlist)
     * - accessSecret / refreshSecret: HS256 서명 키. 반드시 서로 달라야 한다.
     *   (refresh 토큰을 access 자리에 내밀거나 그 반대가 서명 단계에서 걸러지도록)
     * - accessTtlSeconds: Access Token 수명 (기본 30분)
     * - refreshTtlSeconds: Refresh Token 수명 (기본 7일)
     */
    public record Jwt(
        @NotBlank String issuer,
        @NotBlank @Size(min = 32) String accessSecret,
        @NotBlank @Size(min = 32) String refreshSecret,
        @Min(1) long accessTtlSeconds,
        @Min(1) long refreshTtlSeconds
    ) {
        public Duration accessTtl() {
            return Duration.ofSeconds(accessTtlSeconds);
        }

        public Duration refreshTtl() {
            return Duration.ofSeconds(refreshTtlSeconds);
        }
    }

    /**
     * 쿠키 설정 (referenced by AuthCookieUtils)
     * - accessName / refreshName: 토큰을 담을 쿠키 이름 (accessToken / refreshToken)
     * - path: 쿠키 전송 경로
     * - sameSite: SameSite 정책 (Lax / Strict / None)
     * - secure: https 에서만 전송 여부 (운영에선 true)
     */
    public record Cookie(
            @NotBlank String accessName,
            @NotBlank String refreshName,
            @NotBlank String path,
            @NotBlank String sameSite,
            boolean secure
    ) {}

    /**
     * Revocation Store 설정
     * - store: jpa(기본) | memory
     * - purgeInterval: 만료된 엔트리 정리 주기 (RevocationPurgeJob)
     * - timeoutSeconds: store 트랜잭션 타임아웃. 넘기면 "미인증" 취급
     * - reuseDetection: 이미 ROTATED 된 refresh가 다시 들어오면 그 유저의 세션을 전부 폐기
     */
    public record Revocation(
            @NotNull StoreType store,
            @NotNull Duration purgeInterval,
            @Min(1) int timeoutSeconds,
            boolean reuseDetection
    ) {}

    public enum StoreType {
        JPA,
        MEMORY
    }
}
