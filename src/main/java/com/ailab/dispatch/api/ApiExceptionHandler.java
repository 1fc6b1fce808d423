package com.ailab.dispatch.api;

import com.ailab.core.error.EnvironmentException;
import com.ailab.core.error.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps the error taxonomy onto HTTP responses of the form {@code {code, reason, message}}.
 * The {@code code} is always one of the stable {@link ErrorCode} values.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(EnvironmentException.class)
    public ResponseEntity<Map<String, String>> handleEnvironmentException(EnvironmentException e) {
        HttpStatus status = statusFor(e.code());
        if (status.is5xxServerError()) {
            log.warn("Request failed with {}: {}", e.code().code(), e.getMessage());
        } else {
            log.debug("Request rejected with {}: {}", e.code().code(), e.getMessage());
        }
        return ResponseEntity.status(status).body(body(e.code().code(), e.reason(), e.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, String>> handleValidation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(f -> f.getField() + " " + f.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return ResponseEntity.badRequest().body(body("invalid_request", "invalid_request", message));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleIllegalArgument(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(body("invalid_request", "invalid_request", e.getMessage()));
    }

    static HttpStatus statusFor(ErrorCode code) {
        return switch (code) {
            case QUOTA_EXCEEDED, ACCESS_DENIED -> HttpStatus.FORBIDDEN;
            case PORTS_EXHAUSTED, INSUFFICIENT_GPU_CAPACITY, INVALID_STATE -> HttpStatus.CONFLICT;
            case NOT_FOUND, TEMPLATE_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case RUNTIME_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
            case RUNTIME_TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
            case RUNTIME_REJECTED -> HttpStatus.BAD_GATEWAY;
            case LEDGER_CORRUPTION -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    private static Map<String, String> body(String code, String reason, String message) {
        var body = new LinkedHashMap<String, String>();
        body.put("code", code);
        body.put("reason", reason);
        body.put("message", message != null ? message : "");
        return body;
    }
}
