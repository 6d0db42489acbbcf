package com.fixedrate.strategy.engine;

import java.math.BigInteger;

/**
 * Point-in-time read of every engine-level view.
 */
public record StrategySnapshot(
        String address,
        String asset,
        String venue,
        boolean initialized,
        BigInteger totalShares,
        BigInteger totalHoldings,
        BigInteger totalFloat,
        BigInteger totalDelegatedHoldings,
        BigInteger venueBalanceOfUnderlying,
        BigInteger feeShares,
        BigInteger fixedRatePerSecond,
        long withdrawalDelaySeconds,
        long harvestDelaySeconds,
        long pendingHarvestDelaySeconds,
        long lastHarvestTimestamp,
        long nextHarvestAt
) {
}
