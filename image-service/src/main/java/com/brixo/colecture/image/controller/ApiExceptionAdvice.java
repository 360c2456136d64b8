package com.brixo.colecture.image.controller;

import com.brixo.colecture.image.exception.ExtractionException;
import com.brixo.colecture.image.exception.InvalidSlideInputException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Traduce las excepciones de la API a respuestas JSON
 * {@code {ok, status, error, message, path, timestamp}}.
 */
@RestControllerAdvice
public class ApiExceptionAdvice {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionAdvice.class);

    @ExceptionHandler(ExtractionException.class)
    public ResponseEntity<Map<String, Object>> handleExtraction(ExtractionException ex,
            HttpServletRequest request) {
        log.error("Extracción de keywords fallida en {}: {}", request.getRequestURI(), ex.getMessage());
        return error(HttpStatus.BAD_GATEWAY, "extraction_failed", ex.getMessage(), request);
    }

    @ExceptionHandler(InvalidSlideInputException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidInput(InvalidSlideInputException ex,
            HttpServletRequest request) {
        return error(HttpStatus.BAD_REQUEST, "invalid_input", ex.getMessage(), request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex,
            HttpServletRequest request) {
        // La causa raíz suele ser el IllegalArgumentException de un enum o modelo desconocido
        Throwable root = ex.getMostSpecificCause();
        return error(HttpStatus.BAD_REQUEST, "invalid_input",
                root.getMessage() != null ? root.getMessage() : ex.getMessage(), request);
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String code,
            String message, HttpServletRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ok", false);
        body.put("status", status.value());
        body.put("error", code);
        body.put("message", message);
        body.put("path", request.getRequestURI());
        body.put("timestamp", Instant.now().toString());
        return ResponseEntity.status(status).body(body);
    }
}
