package com.fixedrate.api.validation;

/**
 * Thrown when a caller header or path address is not a valid account address.
 */
public class InvalidAddressException extends RuntimeException {

    public InvalidAddressException(String message) {
        super(message);
    }
}
