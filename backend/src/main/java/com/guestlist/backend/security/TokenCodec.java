package com.guestlist.backend.security;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.HashMap;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.guestlist.backend.auth.config.AuthProperties;
import com.guestlist.backend.auth.token.support.TokenGenerator;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.SignatureException;
import lombok.extern.slf4j.Slf4j;

/**
 * 서명된 만료형 토큰(JWT)을 만들고 검증하는 코덱
 *
 * JWT 구조: header.payload.signature
 * - header: 알고리즘/타입 정보 (HS256)
 * - payload: 클레임 (iss/sub/jti/iat/exp/token_type + 호출자가 넘긴 클레임)
 * - signature: header.payload를 SigningKey로 서명한 값(HMAC-SHA256)
 *
 * 부수효과 없음: 결과는 (token, key, 현재시각)에만 의존한다.
 * 검증 실패는 예외가 아니라 TokenVerification(failure)으로 돌려준다.
 * 서명 비교는 jjwt 내부에서 MessageDigest.isEqual(상수 시간)로 수행된다.
 */
@Slf4j
@Component
public class TokenCodec {

    static final String TOKEN_TYPE_CLAIM = "token_type";

    private final Clock clock;
    private final String issuer;
    private final TokenGenerator tokenGenerator; // jti 생성 (같은 초에 발급된 토큰끼리도 문자열이 달라지도록)

    public TokenCodec(Clock clock, AuthProperties props, TokenGenerator tokenGenerator) {
        this.clock = clock;
        this.issuer = props.jwt().issuer();
        this.tokenGenerator = tokenGenerator;
    }

    /**
     * 토큰 발급
     * @param subject  sub 클레임 (identity id)
     * @param payload  추가 클레임 (표준 클레임 이름은 덮어써진다)
     * @param key      서명 키 (access/refresh 별도)
     * @param ttl      수명 (0 이하 불가)
     * @return 토큰 문자열 + iat/exp (store에 natural expiry로 기록할 때 사용)
     */
    public MintedToken mint(String subject, Map<String, Object> payload, SigningKey key, Duration ttl) {
        if (subject == null || subject.isBlank()) throw new IllegalArgumentException("subject must not be blank");
        if (key == null) throw new IllegalArgumentException("key must not be null");
        if (ttl == null || ttl.isZero() || ttl.isNegative()) throw new IllegalArgumentException("ttl must be positive");

        // exp/iat는 초 단위로 직렬화되므로 미리 잘라둔다 (round-trip 시 값이 그대로 복원되도록)
        Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        Instant exp = now.plus(ttl);

        String token = Jwts.builder()
                .setClaims(new HashMap<>(payload == null ? Map.of() : payload))
                .setIssuer(issuer)                          // iss
                .setSubject(subject)                        // sub
                .setId(tokenGenerator.generateTokenId())    // jti
                .claim(TOKEN_TYPE_CLAIM, key.tokenType())   // access | refresh
                .setIssuedAt(Date.from(now))                // iat
                .setExpiration(Date.from(exp))              // exp
                .signWith(key.key(), SignatureAlgorithm.HS256)
                .compact();

        return new MintedToken(token, now, exp);
    }

    /**
     * 토큰 검증
     * - MALFORMED: 형식/클레임 불량 (null, blank 포함)
     * - SIGNATURE_INVALID: 서명 불일치
     * - EXPIRED: now >= exp
     */
    public TokenVerification verify(String token, SigningKey key) {
        if (token == null || token.isBlank()) {
            return TokenVerification.failed(VerificationFailure.MALFORMED);
        }

        try {
            Claims claims = Jwts.parserBuilder()
                    .setSigningKey(key.key())
                    .requireIssuer(issuer)
                    .require(TOKEN_TYPE_CLAIM, key.tokenType())
                    .setClock(() -> Date.from(clock.instant()))
                    .build()
                    .parseClaimsJws(token)
                    .getBody();

            // jjwt는 now > exp 일 때만 만료로 본다. 여기서는 now == exp 도 만료.
            Date exp = claims.getExpiration();
            if (exp == null) {
                return TokenVerification.failed(VerificationFailure.MALFORMED);
            }
            if (!clock.instant().isBefore(exp.toInstant())) {
                return TokenVerification.failed(VerificationFailure.EXPIRED);
            }
            return TokenVerification.verified(claims);

        } catch (ExpiredJwtException e) {
            return TokenVerification.failed(VerificationFailure.EXPIRED);
        } catch (SignatureException e) {
            return TokenVerification.failed(VerificationFailure.SIGNATURE_INVALID);
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Malformed {} token: {}", key.tokenType(), e.getMessage());
            return TokenVerification.failed(VerificationFailure.MALFORMED);
        }
    }
}
