package com.example.obd2live.controller;

import com.example.obd2live.exception.InvalidStateTransitionException;
import com.example.obd2live.exception.SessionNotFoundException;
import com.example.obd2live.exception.TransientStoreException;
import com.example.obd2live.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;

import java.time.Instant;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler({ValidationException.class, ServerWebInputException.class})
    public ResponseEntity<ErrorResponse> handleValidation(Exception ex, ServerWebExchange exchange) {
        logger.warn("Rejected request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Bad Request", ex.getMessage(), exchange);
    }

    @ExceptionHandler(SessionNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(SessionNotFoundException ex, ServerWebExchange exchange) {
        logger.warn("SessionNotFoundException: {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage(), exchange);
    }

    @ExceptionHandler(InvalidStateTransitionException.class)
    public ResponseEntity<ErrorResponse> handleInvalidTransition(InvalidStateTransitionException ex, ServerWebExchange exchange) {
        logger.warn("Invalid transition for session {}: {} -> {}", ex.getSessionId(), ex.getFrom(), ex.getTo());
        return respond(HttpStatus.CONFLICT, "Conflict", ex.getMessage(), exchange);
    }

    @ExceptionHandler(TransientStoreException.class)
    public ResponseEntity<ErrorResponse> handleStoreUnavailable(TransientStoreException ex, ServerWebExchange exchange) {
        logger.error("Store unavailable at path {}: {}", exchange.getRequest().getPath(), ex.getMessage(), ex);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "Service Unavailable", ex.getMessage(), exchange);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneric(Exception ex, ServerWebExchange exchange) {
        logger.error("An unexpected error occurred at path {}:", exchange.getRequest().getPath(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred. Please try again later.", exchange);
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String message, ServerWebExchange exchange) {
        ErrorResponse body = new ErrorResponse(Instant.now(), status.value(), error, message,
                exchange.getRequest().getPath().toString());
        return new ResponseEntity<>(body, status);
    }
}
