package com.lolanalyzer.riot.controller;

import com.lolanalyzer.riot.exception.ApiNotFoundException;
import com.lolanalyzer.riot.exception.ApiTransportException;
import com.lolanalyzer.riot.exception.ApiUnauthorizedException;
import com.lolanalyzer.riot.exception.UnclassifiedApiException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(ApiNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(ApiNotFoundException ex) {
        return error(ex.getMessage(), HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(ApiUnauthorizedException.class)
    public ResponseEntity<ErrorResponse> handleUnauthorized(ApiUnauthorizedException ex) {
        log.error("Upstream rejected the configured API key ({})", ex.getStatus());
        return error("Upstream API rejected the gateway credentials", HttpStatus.BAD_GATEWAY);
    }

    @ExceptionHandler(UnclassifiedApiException.class)
    public ResponseEntity<ErrorResponse> handleUnclassified(UnclassifiedApiException ex) {
        return error("Upstream API error: " + ex.getStatus(), HttpStatus.BAD_GATEWAY);
    }

    @ExceptionHandler(ApiTransportException.class)
    public ResponseEntity<ErrorResponse> handleTransport(ApiTransportException ex) {
        return error("Upstream API unreachable", HttpStatus.GATEWAY_TIMEOUT);
    }

    @ExceptionHandler({IllegalArgumentException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex) {
        return error(ex.getMessage(), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        log.error("Unexpected error", ex);
        return error("An unexpected error occurred", HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private ResponseEntity<ErrorResponse> error(String message, HttpStatus status) {
        ErrorResponse error = new ErrorResponse(
            message,
            status.value(),
            Instant.now().toEpochMilli()
        );
        return new ResponseEntity<>(error, status);
    }
}
