package com.stationsync.synchronizer.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.codec.DecodingException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Maps control API failures to {@link ErrorResponse} bodies.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(WebExchangeBindException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleValidationException(
            WebExchangeBindException ex, ServerWebExchange exchange) {

        List<String> details = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .toList();
        String path = exchange.getRequest().getPath().value();
        log.warn("Validation failed for {}: {}", path, details);

        return respond(HttpStatus.BAD_REQUEST,
                ErrorResponse.of(HttpStatus.BAD_REQUEST.value(), "Validation Failed",
                        "Request validation failed", path, details));
    }

    @ExceptionHandler(DecodingException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleDecodingException(
            DecodingException ex, ServerWebExchange exchange) {

        String message = ex.getCause() != null ? ex.getCause().getMessage() : "Invalid JSON format";
        return badRequest("Invalid Request Body", message, exchange);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleIllegalArgument(
            IllegalArgumentException ex, ServerWebExchange exchange) {
        return badRequest("Bad Request", ex.getMessage(), exchange);
    }

    /**
     * A sync already running, or an operation that needs the worker stopped.
     */
    @ExceptionHandler(IllegalStateException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleConflict(
            IllegalStateException ex, ServerWebExchange exchange) {

        String path = exchange.getRequest().getPath().value();
        log.warn("Rejected {}: {}", path, ex.getMessage());
        return respond(HttpStatus.CONFLICT,
                ErrorResponse.of(HttpStatus.CONFLICT.value(), "Conflict", ex.getMessage(), path));
    }

    @ExceptionHandler(PlatformAuthenticationException.class)
    public Mono<ResponseEntity<ErrorResponse>> handlePlatformAuthentication(
            PlatformAuthenticationException ex, ServerWebExchange exchange) {

        String path = exchange.getRequest().getPath().value();
        log.error("Platform login failed for {}: {}", path, ex.getMessage());
        return respond(HttpStatus.BAD_GATEWAY,
                ErrorResponse.of(HttpStatus.BAD_GATEWAY.value(), "Bad Gateway",
                        "Telemetry platform rejected the login", path));
    }

    @ExceptionHandler(SyncException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleSyncException(
            SyncException ex, ServerWebExchange exchange) {

        String path = exchange.getRequest().getPath().value();
        log.error("Upstream failure for {}: {}", path, ex.getMessage());
        return respond(HttpStatus.BAD_GATEWAY,
                ErrorResponse.of(HttpStatus.BAD_GATEWAY.value(), "Bad Gateway", ex.getMessage(), path));
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ErrorResponse>> handleGenericException(
            Exception ex, ServerWebExchange exchange) {

        String path = exchange.getRequest().getPath().value();
        log.error("Unexpected error for {}: {}", path, ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR,
                ErrorResponse.of(HttpStatus.INTERNAL_SERVER_ERROR.value(), "Internal Server Error",
                        "An unexpected error occurred", path));
    }

    private Mono<ResponseEntity<ErrorResponse>> badRequest(String error, String message, ServerWebExchange exchange) {
        String path = exchange.getRequest().getPath().value();
        log.warn("{} for {}: {}", error, path, message);
        return respond(HttpStatus.BAD_REQUEST,
                ErrorResponse.of(HttpStatus.BAD_REQUEST.value(), error, message, path));
    }

    private static Mono<ResponseEntity<ErrorResponse>> respond(HttpStatus status, ErrorResponse body) {
        return Mono.just(ResponseEntity.status(status).body(body));
    }
}
