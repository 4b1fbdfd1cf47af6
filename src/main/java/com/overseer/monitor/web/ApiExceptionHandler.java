package com.overseer.monitor.web;

import com.overseer.monitor.common.NotFoundException;
import com.overseer.monitor.common.OverseerException;
import com.overseer.monitor.provider.ProviderCommandException;
import com.overseer.monitor.provider.ProviderStartException;
import com.overseer.monitor.service.DeviceNotRunningException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/** Maps core errors to HTTP statuses; the user-facing message and its properties go in the body. */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(OverseerException.class)
    public ResponseEntity<Map<String, Object>> overseer(OverseerException e) {
        HttpStatus status = statusFor(e);
        log.info("[REST] {} {}: {}", status.value(), e.getClass().getSimpleName(), e.getMessage());
        return ResponseEntity.status(status).body(body(e.getClass().getSimpleName(), e.getMessage(), e.getProperties()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> invalid(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(body("IllegalArgument", e.getMessage(), null));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> unreadable(HttpMessageNotReadableException e) {
        Throwable root = e.getMostSpecificCause();
        return ResponseEntity.badRequest().body(body("InvalidBody", root.getMessage(), null));
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<Map<String, Object>> unexpected(RuntimeException e) {
        if (e instanceof ErrorResponse er) {
            return ResponseEntity.status(er.getStatusCode()).body(body(e.getClass().getSimpleName(), e.getMessage(), null));
        }
        // a provider may wrap its own OverseerException in something else
        return OverseerException.unwrap(e)
                .map(this::overseer)
                .orElseGet(() -> {
                    log.warn("[REST] 500 {}", e.toString(), e);
                    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                            .body(body("Internal", e.getMessage(), null));
                });
    }

    static HttpStatus statusFor(OverseerException e) {
        if (e instanceof NotFoundException) return HttpStatus.NOT_FOUND;
        if (e instanceof DeviceNotRunningException) return HttpStatus.CONFLICT;
        if (e instanceof ProviderStartException || e instanceof ProviderCommandException) return HttpStatus.BAD_GATEWAY;
        return HttpStatus.BAD_REQUEST;
    }

    private static Map<String, Object> body(String error, String message, Object properties) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("error", error);
        m.put("message", message);
        if (properties != null) m.put("properties", properties);
        return m;
    }
}
