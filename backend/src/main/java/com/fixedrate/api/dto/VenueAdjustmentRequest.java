package com.fixedrate.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.math.BigInteger;

/**
 * POST /api/v1/simulation/venue/accrue and /loss body.
 */
public record VenueAdjustmentRequest(@NotNull @Positive BigInteger amount) {
}
