package com.nevis.chat.controller;

import com.nevis.chat.exception.InsufficientBalanceException;
import com.nevis.chat.exception.TurnException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
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

    @ExceptionHandler(InsufficientBalanceException.class)
    public ResponseEntity<ErrorResponse> handleInsufficientBalance(InsufficientBalanceException ex) {
        ErrorResponse error = new ErrorResponse(
            ex.getMessage(),
            ex.getCode(),
            ex.getStatus().value(),
            Instant.now().toEpochMilli(),
            ex.getRemainingBalanceCents()
        );
        return new ResponseEntity<>(error, ex.getStatus());
    }

    @ExceptionHandler(TurnException.class)
    public ResponseEntity<ErrorResponse> handleTurnException(TurnException ex) {
        if (ex.getStatus().is5xxServerError()) {
            log.error("Request failed with {}: {}", ex.getCode(), ex.getMessage());
        } else {
            log.debug("Request rejected with {}: {}", ex.getCode(), ex.getMessage());
        }
        ErrorResponse error = new ErrorResponse(
            ex.getMessage(),
            ex.getCode(),
            ex.getStatus().value(),
            Instant.now().toEpochMilli()
        );
        return new ResponseEntity<>(error, ex.getStatus());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
            .map(fieldError -> fieldError.getField() + " " + fieldError.getDefaultMessage())
            .collect(Collectors.joining("; "));
        return badRequest(message.isEmpty() ? "Invalid request" : message, "invalid_request");
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException ex) {
        return badRequest(String.format("Header '%s' is missing", ex.getHeaderName()), "missing_header");
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleUnreadable(Exception ex) {
        return badRequest("Malformed request", "invalid_request");
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleDataAccess(DataAccessException ex) {
        log.error("Database operation failed", ex);
        return internalError();
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        log.error("Unhandled error", ex);
        return internalError();
    }

    private static ResponseEntity<ErrorResponse> badRequest(String message, String code) {
        ErrorResponse error = new ErrorResponse(
            message,
            code,
            HttpStatus.BAD_REQUEST.value(),
            Instant.now().toEpochMilli()
        );
        return new ResponseEntity<>(error, HttpStatus.BAD_REQUEST);
    }

    private static ResponseEntity<ErrorResponse> internalError() {
        ErrorResponse error = new ErrorResponse(
            "An unexpected error occurred",
            "internal_error",
            HttpStatus.INTERNAL_SERVER_ERROR.value(),
            Instant.now().toEpochMilli()
        );
        return new ResponseEntity<>(error, HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
