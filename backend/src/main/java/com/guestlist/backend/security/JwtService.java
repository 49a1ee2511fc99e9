package com.guestlist.backend.security;

import java.security.MessageDigest;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Map;

import org.springframework.stereotype.Service;

import com.guestlist.backend.auth.config.AuthProperties;
import com.guestlist.backend.auth.identity.provider.UserRecord;

/**
 * Access / Refresh 토큰 발급/검증 서비스
 * - TokenCodec에 "어떤 키로, 어떤 수명으로"를 묶어준다.
 *
 * Access Token:
 * - 매 요청마다 서버에게 내 신원을 증명하는 짧은 수명 토큰 (기본 30분)
 * - 서명/만료만 본다. revocation 목록은 조회하지 않는다.
 *
 * Refresh Token:
 * - Access Token 재발급용 긴 수명 토큰 (기본 7일)
 * - payload엔 userId(sub)와 jti만. 폐기 여부는 RevocationStore가 판단.
 *
 * 두 토큰은 서로 다른 secret으로 서명한다. 같은 값이면 부팅 실패.
 */
@Service
public class JwtService {

    public static final String ACCESS_TOKEN_TYPE = "access";
    public static final String REFRESH_TOKEN_TYPE = "refresh";

    private final TokenCodec codec;
    private final AuthProperties.Jwt jwtProps;
    private final SigningKey accessKey;
    private final SigningKey refreshKey;

    public JwtService(TokenCodec codec, AuthProperties props) {
        this.codec = codec;
        this.jwtProps = props.jwt();

        byte[] access = jwtProps.accessSecret().getBytes(StandardCharsets.UTF_8);
        byte[] refresh = jwtProps.refreshSecret().getBytes(StandardCharsets.UTF_8);
        if (MessageDigest.isEqual(access, refresh)) {
            throw new IllegalStateException("access secret and refresh secret must differ");
        }

        this.accessKey = SigningKey.hmac(ACCESS_TOKEN_TYPE, jwtProps.accessSecret());
        this.refreshKey = SigningKey.hmac(REFRESH_TOKEN_TYPE, jwtProps.refreshSecret());
    }

    // 현재 사용자 상태 스냅샷으로 Access Token 발행
    public MintedToken issueAccessToken(UserRecord user) {
        if (user == null || user.id() == null) throw new IllegalArgumentException("user id must not be null");
        if (user.roles() == null || user.roles().isEmpty()) throw new IllegalArgumentException("roles must not be empty");

        Map<String, Object> payload = Map.of(
                AccessClaims.EMAIL_CLAIM, user.email(),
                AccessClaims.USER_NAME_CLAIM, user.userName(),
                AccessClaims.ROLES_CLAIM, new ArrayList<>(user.roles()),
                AccessClaims.ALLOWED_CLAIM, user.allowed()
        );
        return codec.mint(String.valueOf(user.id()), payload, accessKey, jwtProps.accessTtl());
    }

    public TokenVerification verifyAccessToken(String token) {
        return codec.verify(token, accessKey);
    }

    public MintedToken issueRefreshToken(Long userId) {
        if (userId == null) throw new IllegalArgumentException("userId must not be null");
        return codec.mint(String.valueOf(userId), Map.of(), refreshKey, jwtProps.refreshTtl());
    }

    public TokenVerification verifyRefreshToken(String token) {
        return codec.verify(token, refreshKey);
    }
}
