package com.guestlist.backend.auth.session.service;

import java.util.List;
import java.util.Optional;

import org.springframework.stereotype.Service;

import com.guestlist.backend.auth.config.AuthProperties;
import com.guestlist.backend.auth.identity.provider.IdentityProvider;
import com.guestlist.backend.auth.identity.provider.UserRecord;
import com.guestlist.backend.auth.token.domain.RefreshRevokeReason;
import com.guestlist.backend.auth.token.domain.RevocationEntry;
import com.guestlist.backend.auth.token.store.RevocationStore;
import com.guestlist.backend.auth.token.support.CookieWrite;
import com.guestlist.backend.auth.token.support.CredentialCookie;
import com.guestlist.backend.auth.token.support.TokenHashUtils;
import com.guestlist.backend.security.JwtService;
import com.guestlist.backend.security.MintedToken;
import com.guestlist.backend.security.RefreshClaims;
import com.guestlist.backend.security.TokenVerification;
import com.guestlist.backend.security.VerificationFailure;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 세션 유스케이스 (login / refresh / logout / logout-all)
 *
 * - 결과는 항상 SessionOutcome으로 돌려준다. 호출자에게 예외를 던지지 않는다.
 * - store/identity 쪽 런타임 예외(타임아웃 포함)는 STORE_UNAVAILABLE로 바꾼다.
 * - 토큰 원문은 로그에 남기지 않는다.
 *
 * Refresh 정책: 매 사용마다 rotation.
 * - 새 refresh/access를 발급/기록한 뒤 기존 refresh를 ROTATED로 폐기(compare-and-set)
 * - 발급/기록이 실패하면 기존 refresh는 폐기되지 않는다
 * - 같은 refresh로 동시에 두 번 들어오면 한 쪽만 성공하고 나머지는 REVOKED
 * - reuse-detection이 켜져 있으면 ROTATED 토큰 재제출 시 그 유저의 세션을 전부 폐기
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionService {

    private final IdentityProvider identityProvider;
    private final RevocationStore revocationStore;
    private final JwtService jwtService;
    private final TokenHashUtils hashUtils;
    private final AuthProperties props;

    public SessionOutcome login(String email, String password) {
        Optional<UserRecord> user;
        try {
            user = identityProvider.validateCredentials(email, password);
        } catch (RuntimeException e) {
            return unavailable("login", e, List.of());
        }

        if (user.isEmpty()) {
            log.info("Login rejected: {}", AuthFailure.INVALID_CREDENTIALS);
            return SessionOutcome.failed(AuthFailure.INVALID_CREDENTIALS, List.of());
        }
        return startSession(user.get());
    }

    // 로그인/회원가입 직후: access + refresh 발급
    public SessionOutcome startSession(UserRecord user) {
        try {
            return issue(user);
        } catch (RuntimeException e) {
            return unavailable("session start", e, List.of());
        }
    }

    public SessionOutcome refresh(String refreshToken) {
        if (isBlank(refreshToken)) {
            return fail("refresh", AuthFailure.NO_CREDENTIAL);
        }

        try {
            String tokenHash = hashUtils.sha256Hex(refreshToken);

            // 1) 폐기 목록 먼저
            if (revocationStore.isRevoked(tokenHash)) {
                detectReuse(tokenHash);
                return fail("refresh", AuthFailure.REVOKED);
            }

            // 2) 서명/만료
            TokenVerification verification = jwtService.verifyRefreshToken(refreshToken);
            if (!verification.isVerified()) {
                return fail("refresh", AuthFailure.from(verification.failure()));
            }

            // 3) payload
            Optional<RefreshClaims> claims = RefreshClaims.from(verification.claims());
            if (claims.isEmpty()) {
                return fail("refresh", AuthFailure.MALFORMED_PAYLOAD);
            }
            Long userId = claims.get().userId();

            // 4) 현재 사용자 상태
            Optional<UserRecord> user = identityProvider.findById(userId);
            if (user.isEmpty()) {
                return fail("refresh", AuthFailure.USER_NOT_FOUND);
            }

            // 5) rotation
            //    새 토큰을 먼저 발급/기록하고, 그 다음 기존 토큰을 compare-and-set으로 폐기한다.
            //    여기까지 어느 단계에서 실패해도 기존 토큰은 살아 있으므로 클라이언트가 그대로 재시도할 수 있다.
            IssuedPair next = mintAndTrack(user.get());
            if (!revocationStore.revoke(tokenHash, userId, claims.get().expiresAt(), RefreshRevokeReason.ROTATED)) {
                // 동시 요청에 졌다: 방금 만든 토큰은 아무에게도 전달되지 않으므로 바로 폐기
                revocationStore.revoke(next.refreshHash(), userId, next.refresh().expiresAt(), RefreshRevokeReason.ROTATED);
                return fail("refresh", AuthFailure.REVOKED);
            }

            return issued(user.get(), next);
        } catch (RuntimeException e) {
            return unavailable("refresh", e, clearCookies());
        }
    }

    public SessionOutcome logout(String refreshToken) {
        return endSession(refreshToken, false);
    }

    // 모든 기기에서 로그아웃: 제출된 토큰 + 그 유저의 다른 refresh 전부
    public SessionOutcome logoutEverywhere(String refreshToken) {
        return endSession(refreshToken, true);
    }

    private SessionOutcome endSession(String refreshToken, boolean everywhere) {
        String op = everywhere ? "logout-all" : "logout";

        if (isBlank(refreshToken)) {
            return fail(op, AuthFailure.NO_CREDENTIAL);
        }

        try {
            TokenVerification verification = jwtService.verifyRefreshToken(refreshToken);
            if (!verification.isVerified()) {
                VerificationFailure failure = verification.failure();
                if (failure == VerificationFailure.EXPIRED && !everywhere) {
                    // 이미 죽은 토큰: store는 건드리지 않고 쿠키만 지운다
                    log.debug("Logout with expired refresh token");
                    return SessionOutcome.ended(clearCookies());
                }
                log.info("{} rejected: {}", op, failure);
                return fail(op, failure == VerificationFailure.EXPIRED
                        ? AuthFailure.EXPIRED
                        : AuthFailure.INVALID_CREDENTIAL);
            }

            Optional<RefreshClaims> claims = RefreshClaims.from(verification.claims());
            if (claims.isEmpty()) {
                return fail(op, AuthFailure.MALFORMED_PAYLOAD);
            }
            Long userId = claims.get().userId();

            String tokenHash = hashUtils.sha256Hex(refreshToken);
            if (!revocationStore.isRevoked(tokenHash)) {
                RefreshRevokeReason reason = everywhere ? RefreshRevokeReason.LOGOUT_ALL : RefreshRevokeReason.LOGOUT;
                revocationStore.revoke(tokenHash, userId, claims.get().expiresAt(), reason);
            }
            if (everywhere) {
                int revoked = revocationStore.revokeAll(userId, RefreshRevokeReason.LOGOUT_ALL);
                log.info("Logout-all for user {}: {} other sessions revoked", userId, revoked);
            }

            return SessionOutcome.ended(clearCookies());
        } catch (RuntimeException e) {
            return unavailable(op, e, clearCookies());
        }
    }

    // ROTATED 토큰이 다시 들어왔다 = 누군가 예전 토큰을 들고 있다
    private void detectReuse(String tokenHash) {
        if (!props.revocation().reuseDetection()) return;

        Optional<RevocationEntry> entry = revocationStore.findRevocation(tokenHash);
        if (entry.isEmpty() || entry.get().reason() != RefreshRevokeReason.ROTATED) return;

        Long ownerId = entry.get().ownerId();
        int revoked = revocationStore.revokeAll(ownerId, RefreshRevokeReason.REUSE_DETECTED);
        log.warn("Rotated refresh token replayed for user {}; revoked {} active sessions", ownerId, revoked);
    }

    private SessionOutcome issue(UserRecord user) {
        return issued(user, mintAndTrack(user));
    }

    private IssuedPair mintAndTrack(UserRecord user) {
        MintedToken access = jwtService.issueAccessToken(user);
        MintedToken refresh = jwtService.issueRefreshToken(user.id());
        String refreshHash = hashUtils.sha256Hex(refresh.value());
        revocationStore.track(refreshHash, user.id(), refresh.expiresAt());
        return new IssuedPair(access, refresh, refreshHash);
    }

    private SessionOutcome issued(UserRecord user, IssuedPair pair) {
        List<CookieWrite> writes = List.of(
                CookieWrite.set(CredentialCookie.ACCESS, pair.access().value(), props.jwt().accessTtl()),
                CookieWrite.set(CredentialCookie.REFRESH, pair.refresh().value(), props.jwt().refreshTtl()));
        return SessionOutcome.issued(user, pair.access(), pair.refresh(), writes);
    }

    private record IssuedPair(MintedToken access, MintedToken refresh, String refreshHash) {}

    private SessionOutcome fail(String op, AuthFailure failure) {
        log.info("{} failed: {}", op, failure);
        return SessionOutcome.failed(failure, clearCookies());
    }

    private SessionOutcome unavailable(String op, RuntimeException e, List<CookieWrite> writes) {
        log.error("{} failed: {} ({})", op, AuthFailure.STORE_UNAVAILABLE, e.getMessage(), e);
        return SessionOutcome.failed(AuthFailure.STORE_UNAVAILABLE, writes);
    }

    private static List<CookieWrite> clearCookies() {
        return List.of(
                CookieWrite.clear(CredentialCookie.ACCESS),
                CookieWrite.clear(CredentialCookie.REFRESH));
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
