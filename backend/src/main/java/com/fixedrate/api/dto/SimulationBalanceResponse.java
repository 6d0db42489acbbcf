package com.fixedrate.api.dto;

import java.math.BigInteger;

public record SimulationBalanceResponse(
        String account,
        BigInteger assetBalance,
        BigInteger venueBalance,
        BigInteger venuePricePerShare
) {
}
