package com.guestlist.backend.auth.session.service;

import com.guestlist.backend.global.ErrorCode;
import com.guestlist.backend.security.VerificationFailure;

/**
 * 세션 연산 실패 종류
 *
 * 로그에는 이 값을 그대로 남기고, 클라이언트에는 errorCode()로 뭉갠 값만 내려준다.
 */
public enum AuthFailure {
    NO_CREDENTIAL(ErrorCode.AUTH_REQUIRED),
    MALFORMED(ErrorCode.REFRESH_INVALID),
    SIGNATURE_INVALID(ErrorCode.REFRESH_INVALID),
    EXPIRED(ErrorCode.REFRESH_INVALID),
    REVOKED(ErrorCode.REFRESH_INVALID),
    MALFORMED_PAYLOAD(ErrorCode.REFRESH_INVALID),
    USER_NOT_FOUND(ErrorCode.REFRESH_INVALID),
    INVALID_CREDENTIALS(ErrorCode.INVALID_CREDENTIALS),
    INVALID_CREDENTIAL(ErrorCode.REFRESH_INVALID), // logout 시 서명/형식 불량
    STORE_UNAVAILABLE(ErrorCode.REFRESH_INVALID);

    private final ErrorCode errorCode;

    AuthFailure(ErrorCode errorCode) {
        this.errorCode = errorCode;
    }

    public ErrorCode errorCode() {
        return errorCode;
    }

    /**
     * 세션이 아직 없는 요청(login / register)에서 쓰는 코드.
     * store 장애를 "세션 만료"로 내려주지 않고 503으로 구분한다.
     */
    public ErrorCode sessionStartErrorCode() {
        return this == STORE_UNAVAILABLE ? ErrorCode.SERVICE_UNAVAILABLE : errorCode;
    }

    public static AuthFailure from(VerificationFailure failure) {
        return switch (failure) {
            case MALFORMED -> MALFORMED;
            case SIGNATURE_INVALID -> SIGNATURE_INVALID;
            case EXPIRED -> EXPIRED;
        };
    }
}
