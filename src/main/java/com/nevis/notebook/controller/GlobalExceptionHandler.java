package com.nevis.notebook.controller;

import com.nevis.notebook.exception.AuthorizationException;
import com.nevis.notebook.exception.BackendUnavailableException;
import com.nevis.notebook.exception.EmbeddingException;
import com.nevis.notebook.exception.EntityNotFoundException;
import com.nevis.notebook.exception.GenerationException;
import com.nevis.notebook.exception.InvalidStatusTransitionException;
import com.nevis.notebook.exception.ProcessingFailedException;
import com.nevis.notebook.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(ValidationException ex) {
        return error(ex.getMessage(), "VALIDATION_FAILED", HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
            .map(fieldError -> fieldError.getField() + " " + fieldError.getDefaultMessage())
            .collect(Collectors.joining(", "));
        return error(message.isEmpty() ? "Request body is invalid" : message, "VALIDATION_FAILED", HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        return error("Request body is malformed", "VALIDATION_FAILED", HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException ex) {
        String message = String.format("Header '%s' is missing", ex.getHeaderName());
        return error(message, "VALIDATION_FAILED", HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        String message = String.format("Parameter '%s' has an invalid value", ex.getName());
        return error(message, "VALIDATION_FAILED", HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(AuthorizationException.class)
    public ResponseEntity<ErrorResponse> handleAuthorization(AuthorizationException ex) {
        return error(ex.getMessage(), "FORBIDDEN", HttpStatus.FORBIDDEN);
    }

    @ExceptionHandler(EntityNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(EntityNotFoundException ex) {
        return error(ex.getMessage(), "NOT_FOUND", HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(InvalidStatusTransitionException.class)
    public ResponseEntity<ErrorResponse> handleTransition(InvalidStatusTransitionException ex) {
        return error(ex.getMessage(), "INVALID_STATUS", HttpStatus.CONFLICT);
    }

    @ExceptionHandler(ProcessingFailedException.class)
    public ResponseEntity<ErrorResponse> handleProcessingFailed(ProcessingFailedException ex) {
        return error(ex.getMessage(), "PROCESSING_FAILED", HttpStatus.CONFLICT);
    }

    @ExceptionHandler(BackendUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleBackendUnavailable(BackendUnavailableException ex) {
        log.warn("{} backend unavailable: {}", ex.getBackend(), ex.getMessage());
        return error(ex.getMessage(), ex.getBackend() + "_UNAVAILABLE", HttpStatus.SERVICE_UNAVAILABLE);
    }

    @ExceptionHandler({EmbeddingException.class, GenerationException.class})
    public ResponseEntity<ErrorResponse> handleBackendFailure(RuntimeException ex) {
        log.error("Backend call failed: {}", ex.getMessage(), ex);
        return error(ex.getMessage(), "BACKEND_FAILED", HttpStatus.INTERNAL_SERVER_ERROR);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        log.error("Unhandled error", ex);
        return error("An unexpected error occurred", "INTERNAL_ERROR", HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private static ResponseEntity<ErrorResponse> error(String message, String code, HttpStatus status) {
        ErrorResponse body = new ErrorResponse(message, code, status.value(), Instant.now().toEpochMilli());
        return new ResponseEntity<>(body, status);
    }
}
