package com.fixedrate.api.dto;

import java.time.Instant;

/**
 * JSON returned for every refused request. {@code error} carries the engine or validation code the client can
 * switch on; {@code message} is for humans.
 */
public record ErrorBody(String error, String message, Instant timestamp) {

    public static ErrorBody of(String error, String message) {
        return new ErrorBody(error, message, Instant.now());
    }
}
