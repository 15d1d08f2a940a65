package com.boardrag.pipeline.controller;

import com.boardrag.pipeline.exception.DocumentValidityException;
import com.boardrag.pipeline.exception.EntityNotFoundException;
import com.boardrag.pipeline.exception.FileValidationException;
import com.boardrag.pipeline.exception.IllegalStatusTransitionException;
import com.boardrag.pipeline.exception.InvalidDocumentStateException;
import com.boardrag.pipeline.exception.ObjectNotFoundException;
import com.boardrag.pipeline.exception.StorageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

import java.time.Instant;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    static final String RESOURCE_NOT_FOUND = "RESOURCE_NOT_FOUND";
    static final String VALIDATION_FAILED = "VALIDATION_FAILED";
    static final String INVALID_STATE = "INVALID_STATE";
    static final String STORAGE_UNAVAILABLE = "STORAGE_UNAVAILABLE";
    static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    @ExceptionHandler(EntityNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(EntityNotFoundException ex) {
        return error(ex.getMessage(), RESOURCE_NOT_FOUND, HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(ObjectNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleMissingObject(ObjectNotFoundException ex) {
        return error("Stored file not found: " + ex.getKey(), RESOURCE_NOT_FOUND, HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler({
        FileValidationException.class,
        DocumentValidityException.class,
        IllegalArgumentException.class
    })
    public ResponseEntity<ErrorResponse> handleValidation(RuntimeException ex) {
        return error(ex.getMessage(), VALIDATION_FAILED, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
            .map(fieldError -> fieldError.getField() + " " + fieldError.getDefaultMessage())
            .collect(Collectors.joining(", "));
        return error(message, VALIDATION_FAILED, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParams(MissingServletRequestParameterException ex) {
        return error(String.format("Parameter '%s' is missing", ex.getParameterName()), VALIDATION_FAILED, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException ex) {
        return error(String.format("Header '%s' is missing", ex.getHeaderName()), VALIDATION_FAILED, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ErrorResponse> handleTooLarge(MaxUploadSizeExceededException ex) {
        return error("Upload exceeds the maximum request size", VALIDATION_FAILED, HttpStatus.PAYLOAD_TOO_LARGE);
    }

    @ExceptionHandler({
        IllegalStatusTransitionException.class,
        InvalidDocumentStateException.class,
        DuplicateKeyException.class
    })
    public ResponseEntity<ErrorResponse> handleConflict(RuntimeException ex) {
        String message = ex instanceof DuplicateKeyException ? "Duplicate entity" : ex.getMessage();
        return error(message, INVALID_STATE, HttpStatus.CONFLICT);
    }

    @ExceptionHandler(StorageException.class)
    public ResponseEntity<ErrorResponse> handleStorage(StorageException ex) {
        log.error("Storage failure for {}: {}", ex.getKey(), ex.getMessage());
        return error(ex.getMessage(), STORAGE_UNAVAILABLE, HttpStatus.BAD_GATEWAY);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        log.error("Unhandled exception", ex);
        return error("An unexpected error occurred", INTERNAL_ERROR, HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private static ResponseEntity<ErrorResponse> error(String message, String errorCode, HttpStatus status) {
        ErrorResponse error = new ErrorResponse(
            message,
            errorCode,
            status.value(),
            Instant.now().toEpochMilli()
        );
        return new ResponseEntity<>(error, status);
    }
}
