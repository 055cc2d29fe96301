package com.bank.mpin.controller;

import com.bank.mpin.exception.InvalidInputException;
import com.bank.mpin.exception.KeyCustodyException;
import com.bank.mpin.exception.StorageUnavailableException;
import com.bank.mpin.model.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps exceptions to {@link ErrorResponse} bodies. Messages are fixed strings or
 * our own validation messages, never library diagnostics.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(InvalidInputException.class)
    public ResponseEntity<ErrorResponse> handleInvalidInput(InvalidInputException ex) {
        log.debug("Rejected request: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(new ErrorResponse("INVALID_INPUT", ex.getMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.debug("Unreadable request body: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(new ErrorResponse("INVALID_INPUT", "Malformed request body"));
    }

    @ExceptionHandler(StorageUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleStorageUnavailable(StorageUnavailableException ex) {
        log.error("Storage unavailable: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ErrorResponse("STORAGE_UNAVAILABLE", "Service temporarily unavailable. Please retry."));
    }

    @ExceptionHandler(KeyCustodyException.class)
    public ResponseEntity<ErrorResponse> handleKeyCustody(KeyCustodyException ex) {
        log.error("Transport key unavailable: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ErrorResponse("KEYS_UNAVAILABLE", "Service temporarily unavailable. Please retry."));
    }
}
