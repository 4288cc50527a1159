package com.purchasingpower.kgengine.exception;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.UUID;

/**
 * Maps exceptions escaping the controllers to {@link ApiError} bodies.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler({IllegalArgumentException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiError> handleInvalidArgument(Exception ex, HttpServletRequest request) {
        String errorId = generateErrorId();
        log.warn("Invalid request [{}] {}: {}", errorId, request.getRequestURI(), ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, ex.getMessage(), request);
    }

    @ExceptionHandler(GraphStoreException.class)
    public ResponseEntity<ApiError> handleGraphStore(GraphStoreException ex, HttpServletRequest request) {
        String errorId = generateErrorId();
        log.error("❌ Graph store error [{}]: {}", errorId, ex.getMessage(), ex);
        return build(HttpStatus.SERVICE_UNAVAILABLE, errorId, ApiError.GRAPH_STORE_UNAVAILABLE,
            "Graph store unavailable", request);
    }

    @ExceptionHandler(EmbeddingRetrievalException.class)
    public ResponseEntity<ApiError> handleEmbeddingRetrieval(EmbeddingRetrievalException ex,
                                                             HttpServletRequest request) {
        String errorId = generateErrorId();
        log.error("❌ Vector store error [{}]: {}", errorId, ex.getMessage(), ex);
        return build(HttpStatus.SERVICE_UNAVAILABLE, errorId, ApiError.VECTOR_STORE_UNAVAILABLE,
            "Vector store unavailable", request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleUnexpected(Exception ex, HttpServletRequest request) {
        String errorId = generateErrorId();
        log.error("❌ Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, errorId, ApiError.INTERNAL_ERROR,
            "An unexpected error occurred", request);
    }

    private ResponseEntity<ApiError> build(HttpStatus status, String errorId, String code, String message,
                                           HttpServletRequest request) {
        return ResponseEntity.status(status)
            .body(ApiError.builder()
                .errorId(errorId)
                .code(code)
                .message(message)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
    }

    private String generateErrorId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
