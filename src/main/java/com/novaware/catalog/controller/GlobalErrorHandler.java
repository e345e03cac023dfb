package com.novaware.catalog.controller;

import com.novaware.catalog.service.io.InputFileException;
import com.novaware.catalog.store.CatalogConnectionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;

import java.util.HashMap;
import java.util.Map;

/**
 * Maps failures of the admin endpoints to small JSON bodies.
 */
@RestControllerAdvice
public class GlobalErrorHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalErrorHandler.class);

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<Map<String, Object>> handleInput(ServerWebInputException ex) {
        log.warn("Input error: {}", ex.getReason());
        Map<String, Object> body = new HashMap<>();
        body.put("error", "bad_request");
        body.put("reason", ex.getReason());
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(InputFileException.class)
    public ResponseEntity<Map<String, Object>> handleInputFile(InputFileException ex) {
        log.warn("Input file error: {}", ex.getMessage());
        Map<String, Object> body = new HashMap<>();
        body.put("error", "input_file");
        body.put("message", ex.getMessage());
        return ResponseEntity.unprocessableEntity().body(body);
    }

    @ExceptionHandler(CatalogConnectionException.class)
    public ResponseEntity<Map<String, Object>> handleConnection(CatalogConnectionException ex) {
        log.warn("Catalog store unavailable: {}", ex.getMessage());
        Map<String, Object> body = new HashMap<>();
        body.put("error", "store_unavailable");
        body.put("message", ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleOther(Exception ex) {
        log.warn("Unhandled error: {}", ex.toString());
        Map<String, Object> body = new HashMap<>();
        body.put("error", "server_error");
        body.put("exception", ex.getClass().getSimpleName());
        body.put("message", ex.getMessage());
        return ResponseEntity.status(500).body(body);
    }
}
