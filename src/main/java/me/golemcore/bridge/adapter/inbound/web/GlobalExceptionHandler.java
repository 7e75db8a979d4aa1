package me.golemcore.bridge.adapter.inbound.web;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.bridge.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.bridge.domain.exception.NotConnectedException;
import me.golemcore.bridge.domain.exception.SessionBrokenException;
import me.golemcore.bridge.domain.exception.ToolHostConnectionException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

/**
 * Centralized exception handler for the bridge's web controllers.
 *
 * <p>
 * Tool host failures map to 503 so callers can retry once the host is back;
 * using the tool session before it is connected maps to 409.
 */
@ControllerAdvice(basePackages = "me.golemcore.bridge.adapter.inbound.web.controller")
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleResponseStatus(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        log.warn("[API] {}: {}", status, ex.getReason());
        return respond(status, ex.getReason());
    }

    @ExceptionHandler(NotConnectedException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleNotConnected(NotConnectedException ex) {
        log.warn("[API] Conflict: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, ex.getMessage());
    }

    @ExceptionHandler({ ToolHostConnectionException.class, SessionBrokenException.class })
    public Mono<ResponseEntity<ApiErrorResponse>> handleToolHostUnavailable(RuntimeException ex) {
        log.warn("[API] Tool host unavailable: {}", ex.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("[API] Bad request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleGeneric(Exception ex) {
        log.error("[API] Internal server error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }

    private Mono<ResponseEntity<ApiErrorResponse>> respond(HttpStatus status, String message) {
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(status.value())
                .message(message)
                .build();
        return Mono.just(ResponseEntity.status(status).body(body));
    }
}
