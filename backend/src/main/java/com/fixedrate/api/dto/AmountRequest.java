package com.fixedrate.api.dto;

import jakarta.validation.constraints.NotNull;

import java.math.BigInteger;

/**
 * POST /api/v1/strategy/deposit and /withdraw body. Asset units.
 */
public record AmountRequest(@NotNull BigInteger amount) {
}
