package com.shardql.web;

import com.shardql.api.ApiEnvelope;
import com.shardql.api.InvalidRequestException;
import com.shardql.api.TotalFailureException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(InvalidRequestException.class)
    public ResponseEntity<ApiEnvelope> handleInvalidRequest(InvalidRequestException ex) {
        log.warn("Rejected request: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiEnvelope.error(ex.getMessage()));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ApiEnvelope> handleMissingParameter(MissingServletRequestParameterException ex) {
        String message = "Missing " + ex.getParameterName() + " parameter";
        log.warn("Rejected request: {}", message);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiEnvelope.error(message));
    }

    /**
     * Reported with 200 so buffered and streamed responses agree on status.
     */
    @ExceptionHandler(TotalFailureException.class)
    public ResponseEntity<ApiEnvelope> handleTotalFailure(TotalFailureException ex) {
        log.warn("Request produced no data: {} errors={}", ex.getMessage(), ex.getErrors().keySet());
        Map<String, String> errors = ex.getErrors().isEmpty() ? null : ex.getErrors();
        return ResponseEntity.ok(ApiEnvelope.error(ex.getMessage(), errors));
    }

    @ExceptionHandler({NoResourceFoundException.class, NoHandlerFoundException.class})
    public ResponseEntity<ApiEnvelope> handleNotFoundException(Exception ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiEnvelope.error("Not found"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiEnvelope> handleAllExceptions(Exception ex) {
        log.error("Unhandled exception occurred", ex);
        String message = ex.getMessage() != null ? ex.getMessage() : "An unexpected error occurred";
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ApiEnvelope.error(message));
    }
}
