package com.clutch.backend.global;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;

/**
 * 전역 예외 처리기
 * - 컨트롤러/서비스에서 발생한 예외를 공통 응답(ApiError)으로 변환한다.
 * - HTTP 상태코드는 ErrorCode에서만 결정된다.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    static final String BEARER_CHALLENGE = "Bearer";

    /**
     * ApiException 전용 핸들러
     * - 401 계열에는 WWW-Authenticate: Bearer 를 붙인다.
     * - 503(세션 저장소 장애)은 원인 예외까지 로그로 남긴다.
     */
    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ApiError> handleApiException(ApiException e) {
        ResponseEntity.BodyBuilder builder = ResponseEntity.status(e.getStatus());

        if (e.getStatus() == HttpStatus.UNAUTHORIZED) {
            builder.header(HttpHeaders.WWW_AUTHENTICATE, BEARER_CHALLENGE);
        }
        if (e.getStatus().is5xxServerError()) {
            log.error("요청 처리 실패: code={}", e.getCode(), e);
        }

        return builder.body(ApiError.from(e));
    }

    /**
     * @RequestBody + @Valid 검증 실패
     * - 응답은 VALIDATION_ERROR로 통일한다. (상세는 로그로만)
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleMethodArgumentNotValid(MethodArgumentNotValidException e) {

        e.getBindingResult().getFieldErrors()
                .forEach(fe -> log.warn("요청 검증 실패: field={}, message={}", fe.getField(), fe.getDefaultMessage()));

        return validationError();
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiError> handleConstraintViolation(ConstraintViolationException e) {

        e.getConstraintViolations()
                .forEach(v -> log.warn("요청 검증 실패: path={}, message={}", v.getPropertyPath(), v.getMessage()));

        return validationError();
    }

    // 바디 없음 / JSON 문법 오류
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleNotReadable(HttpMessageNotReadableException e) {
        log.warn("요청 바디 파싱 실패: {}", e.getMostSpecificCause().getMessage());
        return validationError();
    }

    /**
     * 처리되지 않은 예외(버그/장애)
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleUnhandled(Exception e) {
        log.error("처리되지 않은 예외", e);
        return ResponseEntity
                .status(ErrorCode.INTERNAL_ERROR.status())
                .body(ApiError.of(ErrorCode.INTERNAL_ERROR));
    }

    private static ResponseEntity<ApiError> validationError() {
        return ResponseEntity
                .status(ErrorCode.VALIDATION_ERROR.status())
                .body(ApiError.of(ErrorCode.VALIDATION_ERROR));
    }
}
