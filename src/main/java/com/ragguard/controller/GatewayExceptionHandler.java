package com.ragguard.controller;

import com.google.gson.JsonParseException;
import com.ragguard.exception.PdfSplitException;
import com.ragguard.exception.UpstreamGenerationException;
import com.ragguard.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.Map;

/**
 * Maps exceptions to the {error, timestamp} envelope
 */
@Slf4j
@RestControllerAdvice
public class GatewayExceptionHandler {

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(ValidationException ex) {
        log.info("Rejected request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler({JsonParseException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<Map<String, Object>> handleMalformedBody(Exception ex) {
        log.info("Malformed request body: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "Malformed JSON request body");
    }

    @ExceptionHandler(UpstreamGenerationException.class)
    public ResponseEntity<Map<String, Object>> handleGeneration(UpstreamGenerationException ex) {
        log.error("Answer generation failed: {}", ex.getMessage(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Answer generation failed");
    }

    @ExceptionHandler(PdfSplitException.class)
    public ResponseEntity<Map<String, Object>> handlePdfSplit(PdfSplitException ex) {
        log.error("PDF split failed: {}", ex.getMessage(), ex);
        return error(HttpStatus.UNPROCESSABLE_ENTITY, "PDF could not be split");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnhandled(Exception ex) {
        log.error("Unhandled exception", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }

    private ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status)
                .body(Map.of("error", message, "timestamp", Instant.now().toString()));
    }
}
