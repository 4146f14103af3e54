package com.vface.api.error;

import com.vface.core.error.ErrorKind;
import com.vface.core.error.RegistryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps registry failures to HTTP responses by {@link ErrorKind}.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(RegistryException.class)
    public ResponseEntity<ErrorResponse> handleRegistry(RegistryException e) {
        HttpStatus status = statusFor(e.getKind());
        if (status.is5xxServerError()) {
            log.error("{} failure [{}]: {}", e.getKind(), e.getCode(), e.getMessage(), e);
        } else {
            log.debug("{} rejection [{}]: {}", e.getKind(), e.getCode(), e.getMessage());
        }
        return ResponseEntity.status(status).body(new ErrorResponse(
                e.getCode(), e.getKind().name(), e.getMessage(), e.isRetryable(), e.getDetails()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
        Map<String, Object> errors = new LinkedHashMap<>();
        for (FieldError error : e.getBindingResult().getFieldErrors()) {
            errors.putIfAbsent(error.getField(), error.getDefaultMessage());
        }
        return ResponseEntity.badRequest().body(new ErrorResponse(
                "VALIDATION_001", ErrorKind.VALIDATION.name(), "Invalid request fields", false, errors));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleUnreadable(Exception e) {
        return ResponseEntity.badRequest().body(ErrorResponse.of(
                "VALIDATION_002", ErrorKind.VALIDATION.name(), "Malformed request", false));
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleDataAccess(DataAccessException e) {
        log.error("Storage failure: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(ErrorResponse.of(
                "INFRA_001", ErrorKind.INFRASTRUCTURE.name(), "Storage temporarily unavailable", true));
    }

    static HttpStatus statusFor(ErrorKind kind) {
        return switch (kind) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case CONFLICT, REPLAY -> HttpStatus.CONFLICT;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case AUTHORIZATION -> HttpStatus.FORBIDDEN;
            case INTEGRITY -> HttpStatus.INTERNAL_SERVER_ERROR;
            case INFRASTRUCTURE -> HttpStatus.SERVICE_UNAVAILABLE;
        };
    }
}
