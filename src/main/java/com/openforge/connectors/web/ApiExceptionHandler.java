package com.openforge.connectors.web;

import com.openforge.connectors.error.ConnectorException;
import com.openforge.connectors.error.ErrorKind;
import com.openforge.connectors.web.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

/**
 * Maps the connector error taxonomy onto HTTP, always with the
 * {@code {"error": {"kind", "message"}}} body tools and clients already know.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(ConnectorException.class)
    public ResponseEntity<ErrorResponse> handleConnector(ConnectorException e) {
        HttpStatus status = statusFor(e.kind());
        if (status.is5xxServerError()) {
            log.error("[Api] {} → HTTP {}: {}", e.kind().code(), status.value(), e.getMessage());
        } else {
            log.warn("[Api] {} → HTTP {}: {}", e.kind().code(), status.value(), e.getMessage());
        }
        return ResponseEntity.status(status).body(ErrorResponse.of(e));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .collect(Collectors.joining("; "));
        return ResponseEntity.badRequest().body(ErrorResponse.of("invalid_request", message));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        return ResponseEntity.badRequest()
                .body(ErrorResponse.of("invalid_request", "Request body is not valid JSON"));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(ErrorResponse.of("invalid_request", e.getMessage()));
    }

    public static HttpStatus statusFor(ErrorKind kind) {
        return switch (kind) {
            case TOOL_ARGUMENT, PROVIDER_PARAMETER -> HttpStatus.BAD_REQUEST;
            case UNKNOWN_TOOL -> HttpStatus.NOT_FOUND;
            case RATE_LIMIT_EXCEEDED, RATE_LIMIT_TIMEOUT -> HttpStatus.TOO_MANY_REQUESTS;
            case TOOL_LOOP_BUDGET_EXCEEDED -> HttpStatus.UNPROCESSABLE_ENTITY;
            case TRANSPORT, VENDOR_API, PROVIDER, PROVIDER_MODEL, PROVIDER_AUTHENTICATION -> HttpStatus.BAD_GATEWAY;
            case CREDENTIAL_NOT_FOUND, TOOL_LOOP_FATAL -> HttpStatus.SERVICE_UNAVAILABLE;
            case CANCELLED -> HttpStatus.REQUEST_TIMEOUT;
            case TOOL_EXECUTION, DUPLICATE_TOOL_NAME, CONFIGURATION -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
