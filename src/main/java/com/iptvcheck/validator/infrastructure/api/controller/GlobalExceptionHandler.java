package com.iptvcheck.validator.infrastructure.api.controller;

import com.iptvcheck.validator.core.exception.InvalidFixPayloadException;
import com.iptvcheck.validator.core.exception.InvalidValidationModeException;
import com.iptvcheck.validator.core.exception.MissingContentException;
import com.iptvcheck.validator.core.exception.ResourceNotFoundException;
import com.iptvcheck.validator.infrastructure.api.dto.ErrorResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

/**
 * Global exception handler for REST API.
 * Handles exceptions globally across all controllers given specific exceptions and returns appropriate HTTP responses.
 * Problems inside the analyzed content never reach this class; they are reported as diagnostics.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(InvalidValidationModeException.class)
    public ResponseEntity<ErrorResponse> handleInvalidMode(InvalidValidationModeException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("INVALID_MODE", ex.getMessage()));
    }

    @ExceptionHandler(InvalidFixPayloadException.class)
    public ResponseEntity<ErrorResponse> handleInvalidFixPayload(InvalidFixPayloadException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("INVALID_FIX_PAYLOAD", ex.getMessage()));
    }

    @ExceptionHandler(MissingContentException.class)
    public ResponseEntity<ErrorResponse> handleMissingContent(MissingContentException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("MISSING_CONTENT", ex.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining("; "));
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("INVALID_REQUEST", message));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("INVALID_REQUEST", "Request body is missing or malformed"));
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(ResourceNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse("NOT_FOUND", ex.getMessage()));
    }
}
