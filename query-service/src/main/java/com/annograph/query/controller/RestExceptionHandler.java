package com.annograph.query.controller;

import com.annograph.query.store.RetrievalException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Map;

@RestControllerAdvice
public class RestExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(RestExceptionHandler.class);

    @ExceptionHandler(RetrievalException.class)
    public ResponseEntity<Map<String, String>> retrievalFailed(RetrievalException ex) {
        log.warn("event=retrieval_failed cause={}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(Map.of("error", "retrieval_unavailable", "message", ex.getMessage()));
    }

    @ExceptionHandler({IllegalArgumentException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, String>> badRequest(Exception ex) {
        String message = ex.getMessage() == null ? "invalid request" : ex.getMessage();
        return ResponseEntity.badRequest().body(Map.of("error", "bad_request", "message", message));
    }
}
