package com.ardesk.collections.config;

import com.ardesk.collections.exception.AggregationFailedException;
import com.ardesk.collections.exception.DependencyUnavailableException;
import com.ardesk.collections.exception.EngineTimeoutException;
import com.ardesk.collections.exception.TenantIsolationException;
import com.ardesk.collections.util.TenantHeaders;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler({
            IllegalArgumentException.class,
            MissingRequestHeaderException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class
    })
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex, HttpServletRequest request) {
        return body(HttpStatus.BAD_REQUEST, ex.getMessage(), request);
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<Map<String, Object>> handleAccessDenied(AccessDeniedException ex, HttpServletRequest request) {
        return body(HttpStatus.FORBIDDEN, "Access denied", request);
    }

    @ExceptionHandler(AggregationFailedException.class)
    public ResponseEntity<Map<String, Object>> handleAggregationFailed(AggregationFailedException ex,
            HttpServletRequest request) {
        return body(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage(), request);
    }

    @ExceptionHandler(TenantIsolationException.class)
    public ResponseEntity<Map<String, Object>> handleIsolation(TenantIsolationException ex, HttpServletRequest request) {
        log.error("Request {} aborted: {}", request.getRequestURI(), ex.getMessage());
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "Tenant isolation violation", request);
    }

    @ExceptionHandler(DependencyUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleDependency(DependencyUnavailableException ex,
            HttpServletRequest request) {
        log.error("Dependency unavailable for {}", request.getRequestURI(), ex);
        return body(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage(), request);
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<Map<String, Object>> handleDataAccess(DataAccessException ex, HttpServletRequest request) {
        log.error("Storage error on {}", request.getRequestURI(), ex);
        return body(HttpStatus.SERVICE_UNAVAILABLE, "Storage unavailable", request);
    }

    @ExceptionHandler(EngineTimeoutException.class)
    public ResponseEntity<Map<String, Object>> handleTimeout(EngineTimeoutException ex, HttpServletRequest request) {
        log.warn(ex.getMessage());
        return body(HttpStatus.GATEWAY_TIMEOUT, ex.getMessage(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleAny(Exception ex, HttpServletRequest request) {
        // Client errors raised by Spring MVC itself keep their own status
        if (ex instanceof ErrorResponse errorResponse) {
            HttpStatus status = HttpStatus.resolve(errorResponse.getStatusCode().value());
            if (status != null && status.is4xxClientError()) {
                log.debug("{} on {}: {}", status.value(), request.getRequestURI(), ex.getMessage());
                return body(status, status.getReasonPhrase(), request, errorResponse.getHeaders());
            }
        }
        log.error("Unhandled error on {}", request.getRequestURI(), ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", request);
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String msg, HttpServletRequest request) {
        return body(status, msg, request, HttpHeaders.EMPTY);
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String msg, HttpServletRequest request,
            HttpHeaders headers) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("timestamp", Instant.now().toString());
        map.put("status", status.value());
        map.put("error", (msg == null || msg.isBlank()) ? status.getReasonPhrase() : msg);
        map.put("path", request.getRequestURI());
        map.put("tenantId", request.getHeader(TenantHeaders.TENANT_HEADER));
        return ResponseEntity.status(status).headers(headers).body(map);
    }
}
