package com.fixedrate.api.dto;

import com.fixedrate.api.validation.AccountAddress;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.math.BigInteger;

/**
 * POST /api/v1/simulation/faucet body: mint simulated asset to the account and approve the strategy to pull it.
 */
public record FaucetRequest(
        @AccountAddress String account,
        @NotNull @Positive BigInteger amount
) {
}
