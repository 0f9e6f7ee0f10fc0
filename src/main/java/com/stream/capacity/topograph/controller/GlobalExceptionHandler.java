package com.stream.capacity.topograph.controller;

import com.stream.capacity.topograph.exception.GraphStoreException;
import com.stream.capacity.topograph.exception.InstanceNameParseException;
import com.stream.capacity.topograph.exception.PlanFetchException;
import com.stream.capacity.topograph.exception.VertexLookupException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps build and query failures onto HTTP responses with a uniform JSON error body.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(PlanFetchException.class)
    public ResponseEntity<Map<String, Object>> handlePlanFetch(PlanFetchException e) {
        HttpStatus status = e.isNotFound() ? HttpStatus.NOT_FOUND : HttpStatus.BAD_GATEWAY;
        log.warn("Plan fetch failed: {}", e.getMessage());
        return error(status, "PLAN_FETCH_FAILED", e.getMessage());
    }

    @ExceptionHandler(InstanceNameParseException.class)
    public ResponseEntity<Map<String, Object>> handleParse(InstanceNameParseException e) {
        log.warn("Plan contains a malformed identifier: {}", e.getMessage());
        return error(HttpStatus.UNPROCESSABLE_ENTITY, "MALFORMED_IDENTIFIER", e.getMessage());
    }

    @ExceptionHandler(VertexLookupException.class)
    public ResponseEntity<Map<String, Object>> handleLookup(VertexLookupException e) {
        log.warn("Vertex lookup failed: {}", e.getMessage());
        return error(HttpStatus.UNPROCESSABLE_ENTITY, "VERTEX_NOT_FOUND", e.getMessage());
    }

    @ExceptionHandler(GraphStoreException.class)
    public ResponseEntity<Map<String, Object>> handleGraphStore(GraphStoreException e) {
        log.error("Graph store failure: {}", e.getMessage(), e);
        return error(HttpStatus.SERVICE_UNAVAILABLE, "GRAPH_STORE_UNAVAILABLE", e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return error(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", message);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException e) {
        return error(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", e.getMessage());
    }

    private ResponseEntity<Map<String, Object>> error(HttpStatus status, String code, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", code);
        body.put("message", message);
        body.put("timestamp", LocalDateTime.now().toString());
        return ResponseEntity.status(status).body(body);
    }
}
