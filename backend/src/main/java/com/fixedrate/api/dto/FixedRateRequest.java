package com.fixedrate.api.dto;

import jakarta.validation.constraints.NotNull;

import java.math.BigInteger;

/**
 * PUT /api/v1/strategy/settings/fixed-rate body. WAD-scaled rate per second.
 */
public record FixedRateRequest(@NotNull BigInteger ratePerSecond) {
}
