package com.fixedrate.strategy.engine;

import java.math.BigInteger;

/**
 * Outcome of one harvest. surplus is the protocol's cut (real profit above the fixed-rate expectation);
 * loss is how far the venue valuation fell below recorded delegated holdings, zero otherwise.
 */
public record HarvestReport(
        long harvestedAt,
        long elapsedSeconds,
        BigInteger observedVenueValue,
        BigInteger realProfit,
        BigInteger expectedProfit,
        BigInteger surplus,
        BigInteger feeShares,
        BigInteger loss,
        long harvestDelaySeconds,
        boolean harvestDelayRolledOver
) {
}
