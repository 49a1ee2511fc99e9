package com.guestlist.backend.global;

import org.springframework.http.HttpStatus;

/**
 * 클라이언트에게 노출되는 에러 코드 모음
 * - name(): 응답 JSON의 code 값
 * - status(): HTTP 상태 코드
 * - defaultMessage(): 사용자에게 보여줄 기본 메시지
 *
 * 세션/토큰 실패는 내부적으로는 세분화(AuthFailure)되어 있지만,
 * 여기서는 "다시 로그인하라"는 하나의 신호로 뭉개서 내려준다.
 */
public enum ErrorCode {

    // ===== 공통 =====
    VALIDATION_ERROR(HttpStatus.BAD_REQUEST, "요청 값이 올바르지 않습니다."),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "서버 오류가 발생했습니다."),
    SERVICE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "일시적으로 요청을 처리할 수 없습니다. 잠시 후 다시 시도해 주세요."),

    // ===== 인증(Access) =====
    AUTH_REQUIRED(HttpStatus.UNAUTHORIZED, "인증이 필요합니다."),
    ACCESS_INVALID(HttpStatus.UNAUTHORIZED, "유효하지 않은 access token 입니다."),

    // ===== 로그인 =====
    INVALID_CREDENTIALS(HttpStatus.UNAUTHORIZED, "이메일 또는 비밀번호가 올바르지 않습니다."),

    // ===== Refresh / 세션 =====
    REFRESH_INVALID(HttpStatus.UNAUTHORIZED, "세션이 만료되었습니다. 다시 로그인해 주세요."),

    // ===== 회원가입 =====
    EMAIL_ALREADY_EXISTS(HttpStatus.CONFLICT, "이미 사용 중인 이메일입니다."),
    USERNAME_ALREADY_EXISTS(HttpStatus.CONFLICT, "이미 사용 중인 사용자 이름입니다.");

    private final HttpStatus status;
    private final String defaultMessage;

    ErrorCode(HttpStatus status, String defaultMessage) {
        this.status = status;
        this.defaultMessage = defaultMessage;
    }

    public HttpStatus status() {
        return status;
    }

    public String defaultMessage() {
        return defaultMessage;
    }
}
