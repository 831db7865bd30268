package com.profileplatform.claims.controller;

import com.profileplatform.claims.config.InferenceConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class ProfileExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ProfileExceptionHandler.class);

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(IllegalArgumentException ex) {
        log.warn("Rejected request. reason={}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "invalid_request", ex.getMessage());
    }

    @ExceptionHandler(InferenceConfigException.class)
    public ResponseEntity<Map<String, Object>> handleConfig(InferenceConfigException ex) {
        log.error("Inference config error. location={}", ex.getLocation(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "inference_config_error", ex.getMessage());
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String code, String details) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", code);
        body.put("details", details);
        return new ResponseEntity<>(body, status);
    }
}
