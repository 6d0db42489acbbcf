package com.fixedrate.api.controller;

import com.fixedrate.api.dto.ErrorBody;
import com.fixedrate.api.validation.InvalidAddressException;
import com.fixedrate.strategy.StrategyException;
import com.fixedrate.venue.VenueException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps refused engine calls to HTTP: authorization 403, lifecycle and timing conflicts 409, bad input 400,
 * collaborator failures 502, arithmetic overflow 422.
 */
@RestControllerAdvice
@Slf4j
public class StrategyExceptionHandler {

    @ExceptionHandler(StrategyException.class)
    public ResponseEntity<ErrorBody> handleStrategy(StrategyException ex) {
        HttpStatus status = statusFor(ex.getErrorCode());
        log.debug("Strategy call refused ({}): {}", ex.getErrorCode(), ex.getMessage());
        return ResponseEntity.status(status).body(ErrorBody.of(ex.getErrorCode(), ex.getMessage()));
    }

    @ExceptionHandler(InvalidAddressException.class)
    public ResponseEntity<ErrorBody> handleInvalidAddress(InvalidAddressException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_ADDRESS", ex.getMessage()));
    }

    @ExceptionHandler(VenueException.class)
    public ResponseEntity<ErrorBody> handleVenue(VenueException ex) {
        log.warn("Venue call failed: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(ErrorBody.of("VENUE_FAILURE", ex.getMessage()));
    }

    @ExceptionHandler(ArithmeticException.class)
    public ResponseEntity<ErrorBody> handleArithmetic(ArithmeticException ex) {
        log.warn("Arithmetic failure: {}", ex.getMessage());
        return ResponseEntity.unprocessableEntity().body(ErrorBody.of("ARITHMETIC_ERROR", ex.getMessage()));
    }

    static HttpStatus statusFor(String errorCode) {
        return switch (errorCode) {
            case StrategyException.UNAUTHORIZED -> HttpStatus.FORBIDDEN;
            case StrategyException.NOT_INITIALIZED,
                 StrategyException.ALREADY_INITIALIZED,
                 StrategyException.HARVEST_TOO_SOON,
                 StrategyException.WITHDRAWAL_TOO_SOON,
                 StrategyException.REENTRANT_CALL -> HttpStatus.CONFLICT;
            case StrategyException.TRANSFER_FAILED -> HttpStatus.BAD_GATEWAY;
            default -> HttpStatus.BAD_REQUEST;
        };
    }
}
