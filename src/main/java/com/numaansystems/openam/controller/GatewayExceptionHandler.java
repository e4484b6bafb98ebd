package com.numaansystems.openam.controller;

import com.numaansystems.openam.exception.InternalOpenAmException;
import com.numaansystems.openam.exception.OpenAmException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.HashMap;
import java.util.Map;

/**
 * Maps handshake errors to 5xx responses.
 *
 * <p>OpenAM transport failures answer {@code 502}, everything else {@code 500}.</p>
 */
@RestControllerAdvice
public class GatewayExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GatewayExceptionHandler.class);

    @ExceptionHandler(InternalOpenAmException.class)
    public ResponseEntity<Map<String, Object>> handleOpenAmUnavailable(InternalOpenAmException e) {
        logger.error("OpenAM unavailable: {}", e.getMessage(), e);
        return error(HttpStatus.BAD_GATEWAY, e.getMessage());
    }

    @ExceptionHandler(OpenAmException.class)
    public ResponseEntity<Map<String, Object>> handleOpenAmError(OpenAmException e) {
        logger.error("OpenAM authentication error: {}", e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
    }

    private ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        Map<String, Object> body = new HashMap<>();
        body.put("success", false);
        body.put("error", message);
        return ResponseEntity.status(status).body(body);
    }
}
