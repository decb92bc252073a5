package com.equixtate.api.controller;

import com.equixtate.api.dto.ErrorBody;
import com.equixtate.common.ErrorKind;
import com.equixtate.common.OnboardingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.util.Optional;

/**
 * Maps workflow errors and request validation failures to ErrorBody (error, message, timestamp).
 * VALIDATION/TRANSITION 400/409, concurrency 409, oracle/registry 503, oracle rejection 422, storage 500,
 * missing 404.
 */
@RestControllerAdvice
@Slf4j
public class OnboardingExceptionHandler {

    @ExceptionHandler(OnboardingException.class)
    public ResponseEntity<ErrorBody> handleOnboarding(OnboardingException ex) {
        HttpStatus status = statusFor(ex.getKind());
        if (status.is5xxServerError()) {
            log.warn("{} ({}): {}", ex.getErrorCode(), ex.getKind(), ex.getMessage());
        }
        return ResponseEntity.status(status).body(ErrorBody.of(ex.getErrorCode(), ex.getMessage()));
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorBody> handleValidation(WebExchangeBindException ex) {
        String error = Optional.ofNullable(ex.getFieldError())
                .map(FieldError::getDefaultMessage)
                .filter(msg -> msg != null && !msg.isBlank())
                .orElse(OnboardingException.INVALID_FIELDS);
        String message = userFacingMessage(error, ex);
        return ResponseEntity.badRequest().body(ErrorBody.of(error, message));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorBody> handleUnreadable(ServerWebInputException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of(OnboardingException.INVALID_FIELDS, ex.getReason()));
    }

    static HttpStatus statusFor(ErrorKind kind) {
        return switch (kind) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case TRANSITION, CONCURRENCY_CONFLICT -> HttpStatus.CONFLICT;
            case ORACLE_UNAVAILABLE, REGISTRY_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
            case ORACLE_REJECTED -> HttpStatus.UNPROCESSABLE_ENTITY;
            case STORAGE -> HttpStatus.INTERNAL_SERVER_ERROR;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
        };
    }

    private static String userFacingMessage(String errorCode, WebExchangeBindException ex) {
        return switch (errorCode) {
            case "INVALID_ADDRESS" -> "Invalid wallet address format";
            default -> ex.getFieldErrors().stream()
                    .findFirst()
                    .map(e -> e.getField() + ": " + e.getDefaultMessage())
                    .orElse("Validation failed");
        };
    }
}
