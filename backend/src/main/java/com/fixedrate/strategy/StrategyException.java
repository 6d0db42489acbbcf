package com.fixedrate.strategy;

import lombok.Getter;

/**
 * Thrown by the engine when a call is refused: failed precondition, missing authorization or a collaborator
 * that reported failure. The call leaves engine state untouched. The API layer maps {@link #getErrorCode()}
 * to an HTTP status.
 */
@Getter
public class StrategyException extends RuntimeException {

    public static final String ZERO_AMOUNT = "ZERO_AMOUNT";
    public static final String INVALID_AMOUNT = "INVALID_AMOUNT";
    public static final String ZERO_SHARES = "ZERO_SHARES";
    public static final String INSUFFICIENT_SHARES = "INSUFFICIENT_SHARES";
    public static final String NOT_INITIALIZED = "NOT_INITIALIZED";
    public static final String ALREADY_INITIALIZED = "ALREADY_INITIALIZED";
    public static final String HARVEST_TOO_SOON = "HARVEST_TOO_SOON";
    public static final String WITHDRAWAL_TOO_SOON = "WITHDRAWAL_TOO_SOON";
    public static final String DELAY_TOO_LONG = "DELAY_TOO_LONG";
    public static final String ZERO_DELAY = "ZERO_DELAY";
    public static final String UNAUTHORIZED = "UNAUTHORIZED";
    public static final String REENTRANT_CALL = "REENTRANT_CALL";
    public static final String TRANSFER_FAILED = "TRANSFER_FAILED";

    private final String errorCode;

    public StrategyException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
