package com.fixedrate.strategy.engine;

import java.math.BigInteger;

/**
 * One depositor's claim: shares, their current asset value and when the withdrawal lock lifts (epoch seconds).
 */
public record AccountPosition(
        String account,
        BigInteger shares,
        BigInteger underlying,
        long lastDepositTimestamp,
        long withdrawableAt
) {
}
