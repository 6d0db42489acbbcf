package com.fixedrate.strategy.engine;

import com.fixedrate.common.FixedPointMath;
import com.fixedrate.domain.AccountId;
import com.fixedrate.domain.StrategyState;
import com.fixedrate.strategy.StrategyException;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;

/**
 * Reconciles the venue's reported value against the fixed-rate expectation. Depositors keep growth up to the
 * fixed rate; anything above it is minted as shares to the fee account, diluting every other holder by exactly
 * the surplus.
 */
@Slf4j
public class HarvestEngine {

    private final StrategyState state;
    private final ShareLedger shareLedger;
    private final CapitalRouter capitalRouter;
    private final AccountId feeAccount;

    public HarvestEngine(StrategyState state, ShareLedger shareLedger, CapitalRouter capitalRouter, AccountId feeAccount) {
        this.state = state;
        this.shareLedger = shareLedger;
        this.capitalRouter = capitalRouter;
        this.feeAccount = feeAccount;
    }

    public long nextHarvestAt() {
        return state.getLastHarvestTimestamp() + state.getHarvestDelaySeconds();
    }

    public boolean isDue(long now) {
        return state.isInitialized() && now >= nextHarvestAt();
    }

    /**
     * Runs one harvest at {@code now} (epoch seconds).
     *
     * @throws StrategyException NOT_INITIALIZED before initialization; HARVEST_TOO_SOON before the delay elapsed
     */
    public HarvestReport harvest(long now) {
        if (!state.isInitialized()) {
            throw new StrategyException(StrategyException.NOT_INITIALIZED, "Harvest before initialization");
        }
        if (now < nextHarvestAt()) {
            throw new StrategyException(StrategyException.HARVEST_TOO_SOON,
                    "Next harvest allowed at " + nextHarvestAt() + ", now " + now);
        }

        BigInteger delegated = state.getTotalDelegatedHoldings();
        BigInteger observed = capitalRouter.venueBalanceOfUnderlying();

        BigInteger realProfit = BigInteger.ZERO;
        BigInteger loss = BigInteger.ZERO;
        if (observed.compareTo(delegated) >= 0) {
            realProfit = observed.subtract(delegated);
        } else {
            // Clamped: no fee; the resync below lets the lower valuation flow into the share price.
            loss = delegated.subtract(observed);
            log.warn("Venue valuation {} below delegated holdings {}: loss {}", observed, delegated, loss);
        }

        long elapsed = now - state.getLastHarvestTimestamp();
        BigInteger growth = FixedPointMath.mul(state.getFixedRatePerSecond(), BigInteger.valueOf(elapsed));
        BigInteger expectedProfit = FixedPointMath.mulWadDown(delegated, growth);

        BigInteger surplus = realProfit.compareTo(expectedProfit) > 0
                ? realProfit.subtract(expectedProfit)
                : BigInteger.ZERO;

        BigInteger feeShares = BigInteger.ZERO;
        if (surplus.signum() > 0) {
            // Priced against holdings before the resync.
            feeShares = shareLedger.sharesForAssets(surplus);
            shareLedger.mint(feeAccount, feeShares);
        }

        state.setTotalDelegatedHoldings(observed);
        state.setLastHarvestTimestamp(now);

        boolean rolledOver = false;
        if (state.getPendingHarvestDelaySeconds() != 0) {
            state.setHarvestDelaySeconds(state.getPendingHarvestDelaySeconds());
            state.setPendingHarvestDelaySeconds(0);
            rolledOver = true;
        }

        return new HarvestReport(now, elapsed, observed, realProfit, expectedProfit, surplus, feeShares, loss,
                state.getHarvestDelaySeconds(), rolledOver);
    }
}
