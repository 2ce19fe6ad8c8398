package com.example.rainbowradar.controller;

import com.example.rainbowradar.exception.InvalidCoordinateException;
import com.example.rainbowradar.exception.InvalidGridConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(InvalidCoordinateException.class)
    public ResponseEntity<Map<String, String>> handleInvalidCoordinate(InvalidCoordinateException e) {
        logger.debug("Rejected request: {}", e.getMessage());
        return badRequest("INVALID_COORDINATE", e.getMessage());
    }

    @ExceptionHandler(InvalidGridConfigException.class)
    public ResponseEntity<Map<String, String>> handleInvalidGridConfig(InvalidGridConfigException e) {
        logger.debug("Rejected request: {}", e.getMessage());
        return badRequest("INVALID_GRID_CONFIG", e.getMessage());
    }

    private ResponseEntity<Map<String, String>> badRequest(String code, String message) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", code);
        body.put("message", message);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }
}
