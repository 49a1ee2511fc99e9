package com.guestlist.backend.auth.session.web;

import org.springframework.http.ResponseEntity;

import com.guestlist.backend.auth.session.service.AuthFailure;
import com.guestlist.backend.global.ApiError;
import com.guestlist.backend.global.ErrorCode;

// 쿠키를 이미 써둔 응답에서 실패를 내려줄 때 (예외로 던지지 않고 바로 body를 만든다)
final class SessionResponses {

    private SessionResponses() {}

    static ResponseEntity<ApiError> failure(AuthFailure failure) {
        ErrorCode code = failure.errorCode();
        return ResponseEntity.status(code.status()).body(ApiError.of(code));
    }
}
