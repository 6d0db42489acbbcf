package com.fixedrate.venue;

/**
 * Thrown when a venue call cannot be carried out (insufficient shares, token refused the transfer).
 */
public class VenueException extends RuntimeException {

    public VenueException(String message) {
        super(message);
    }

    public VenueException(String message, Throwable cause) {
        super(message, cause);
    }
}
