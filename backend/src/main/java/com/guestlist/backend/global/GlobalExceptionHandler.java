package com.guestlist.backend.global;

import static org.springframework.http.HttpStatus.BAD_REQUEST;
import static org.springframework.http.HttpStatus.INTERNAL_SERVER_ERROR;

import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;

/**
 * 전역 예외 처리기
 * - 컨트롤러/서비스에서 발생한 예외를 가로채
 * - HTTP 상태 코드 + ApiError 포맷으로 통일된 응답을 반환
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * ApiException 전용 핸들러
     * - 서비스/도메인 로직에서 의도적으로 던진 예외
     */
    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ApiError> handle(ApiException e) {
        return ResponseEntity
                .status(e.getStatus())
                .body(ApiError.of(e.getCode(), e.getMessage(), e.getDetails()));
    }

    /**
     * @RequestBody + @Valid 검증 실패
     * - 클라이언트에는 상세 정보 노출 안 하고 서버 로그에만 필드/메시지 기록
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handle(MethodArgumentNotValidException e) {
        e.getBindingResult().getFieldErrors()
                .forEach(fe -> log.warn("Validation error: field={}, message={}",
                            fe.getField(),
                            fe.getDefaultMessage()));

        return ResponseEntity
                .status(BAD_REQUEST)
                .body(ApiError.of(ErrorCode.VALIDATION_ERROR));
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiError> handle(ConstraintViolationException e) {
        return ResponseEntity
                .status(BAD_REQUEST)
                .body(ApiError.of(ErrorCode.VALIDATION_ERROR));
    }

    // JSON 자체가 깨진 요청 (body 없음 / 문법 오류)
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handle(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMostSpecificCause().getMessage());
        return ResponseEntity
                .status(BAD_REQUEST)
                .body(ApiError.of(ErrorCode.VALIDATION_ERROR));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handle(Exception e) {
        log.error("Unhandled exception", e);
        return ResponseEntity
                .status(INTERNAL_SERVER_ERROR)
                .body(ApiError.of(ErrorCode.INTERNAL_ERROR));
    }
}
