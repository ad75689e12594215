package com.give.payout.api.exception;

import com.give.payout.domain.exception.ErrorCategory;
import com.give.payout.domain.exception.PayoutErrorCode;
import com.give.payout.domain.exception.PayoutException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Clock;
import java.time.Instant;

/**
 * Maps router failures to HTTP statuses by error category
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private final Clock clock;

    public GlobalExceptionHandler(Clock clock) {
        this.clock = clock;
    }

    @ExceptionHandler(PayoutException.class)
    public ResponseEntity<ErrorResponse> handlePayoutException(PayoutException ex, HttpServletRequest request) {
        HttpStatus status = statusFor(ex.getCode());
        if (status.is5xxServerError()) {
            log.warn("{} {} unavailable: {} {}", request.getMethod(), request.getRequestURI(), ex.getCode(), ex.getMessage());
        } else {
            log.info("{} {} rejected: {} {}", request.getMethod(), request.getRequestURI(), ex.getCode(), ex.getMessage());
        }

        return build(status, ex.getCode().name(), ex.getCategory(), ex.isRetryable(), ex.getMessage(), request);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class})
    public ResponseEntity<ErrorResponse> handleMalformedRequest(Exception ex, HttpServletRequest request) {
        log.info("Malformed request to {}: {}", request.getRequestURI(), ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "MALFORMED_REQUEST", ErrorCategory.VALIDATION, false,
                "Request could not be parsed", request);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleIllegalState(IllegalStateException ex, HttpServletRequest request) {
        log.error("Router not ready serving {}", request.getRequestURI(), ex);
        return build(HttpStatus.SERVICE_UNAVAILABLE, "NOT_READY", ErrorCategory.SYSTEM, true, ex.getMessage(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("Unexpected error serving {}", request.getRequestURI(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", ErrorCategory.SYSTEM, false,
                "An unexpected error occurred", request);
    }

    static HttpStatus statusFor(PayoutErrorCode code) {
        switch (code.getCategory()) {
            case VALIDATION:
                return code == PayoutErrorCode.ALREADY_PAUSED || code == PayoutErrorCode.NOT_PAUSED
                        ? HttpStatus.CONFLICT
                        : HttpStatus.BAD_REQUEST;
            case AUTHORIZATION:
                return HttpStatus.FORBIDDEN;
            case DOMAIN_STATE:
                return code == PayoutErrorCode.INSUFFICIENT_BALANCE || code == PayoutErrorCode.TRANSFER_FAILED
                        ? HttpStatus.CONFLICT
                        : HttpStatus.UNPROCESSABLE_ENTITY;
            case SYSTEM:
            default:
                return code == PayoutErrorCode.REENTRANT_CALL
                        ? HttpStatus.CONFLICT
                        : HttpStatus.SERVICE_UNAVAILABLE;
        }
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, String errorCode, ErrorCategory category,
                                                boolean retryable, String message, HttpServletRequest request) {
        ErrorResponse body = ErrorResponse.builder()
                .errorCode(errorCode)
                .category(category)
                .retryable(retryable)
                .message(message)
                .status(status.value())
                .timestamp(Instant.now(clock))
                .path(request.getRequestURI())
                .build();
        return ResponseEntity.status(status).body(body);
    }
}
