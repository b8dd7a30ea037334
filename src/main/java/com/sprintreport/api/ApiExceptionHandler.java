package com.sprintreport.api;

import com.sprintreport.infrastructure.cache.CacheStoreException;
import com.sprintreport.infrastructure.upstream.UpstreamFetchException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Map;

/**
 * Maps failures to status codes. Upstream details stay in the log; clients get a
 * generic message.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(UpstreamFetchException.class)
    public ResponseEntity<Map<String, String>> handleUpstream(UpstreamFetchException e) {
        log.warn("Upstream failure in {}: {}", e.getOperation(), e.getMessage());
        return error(HttpStatus.BAD_GATEWAY, "Upstream service request failed");
    }

    @ExceptionHandler(CallNotPermittedException.class)
    public ResponseEntity<Map<String, String>> handleCircuitOpen(CallNotPermittedException e) {
        log.warn("Circuit open: {}", e.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, "Upstream service temporarily unavailable");
    }

    @ExceptionHandler(CacheStoreException.class)
    public ResponseEntity<Map<String, String>> handleCacheStore(CacheStoreException e) {
        log.error("Cache store failure: {}", e.getMessage(), e);
        return error(HttpStatus.SERVICE_UNAVAILABLE, "Cache store unavailable");
    }

    @ExceptionHandler({
            IllegalArgumentException.class,
            MethodArgumentNotValidException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class,
            HttpMessageNotReadableException.class
    })
    public ResponseEntity<Map<String, String>> handleBadRequest(Exception e) {
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleUnexpected(Exception e) {
        log.error("Unexpected error: {}", e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Internal error");
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of("error", message != null ? message : status.getReasonPhrase()));
    }
}
