package me.golemcore.gateway.adapter.inbound.web;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.gateway.domain.exception.ProviderUnavailableException;
import me.golemcore.gateway.domain.exception.SessionNotFoundException;
import me.golemcore.gateway.domain.exception.UsageLimitExceededException;
import me.golemcore.gateway.domain.exception.VendorCallException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

/**
 * Maps gateway exceptions to {@link ApiErrorResponse} bodies for the REST
 * controllers. Streaming endpoints report their failures in-band instead.
 */
@ControllerAdvice(basePackages = "me.golemcore.gateway.adapter.inbound.web.controller")
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleResponseStatus(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        log.warn("[API] {}: {}", status, ex.getReason());
        return respond(status, ex.getReason());
    }

    @ExceptionHandler(ProviderUnavailableException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleProviderUnavailable(ProviderUnavailableException ex) {
        log.warn("[API] Provider unavailable: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(SessionNotFoundException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleSessionNotFound(SessionNotFoundException ex) {
        log.warn("[API] {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, ex.getMessage());
    }

    @ExceptionHandler(UsageLimitExceededException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleUsageLimit(UsageLimitExceededException ex) {
        log.warn("[API] {}", ex.getMessage());
        return respond(HttpStatus.TOO_MANY_REQUESTS, ex.getMessage());
    }

    @ExceptionHandler(VendorCallException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleVendorCall(VendorCallException ex) {
        log.warn("[API] Backend call failed: {}", ex.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("[API] Bad request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(IllegalStateException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalState(IllegalStateException ex) {
        log.warn("[API] Conflict: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleGeneric(Exception ex) {
        log.error("[API] Internal server error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }

    private static Mono<ResponseEntity<ApiErrorResponse>> respond(HttpStatus status, String message) {
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(status.value())
                .message(message)
                .build();
        return Mono.just(ResponseEntity.status(status).body(body));
    }
}
