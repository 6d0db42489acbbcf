package com.fixedrate.strategy.engine;

import com.fixedrate.common.FixedPointMath;
import com.fixedrate.domain.AccountId;
import com.fixedrate.domain.StrategyState;
import com.fixedrate.strategy.StrategyException;
import com.fixedrate.venue.AssetToken;
import com.fixedrate.venue.YieldVenue;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;

/**
 * Splits holdings into idle float (asset held by the engine address) and capital delegated to the venue, and moves
 * asset between the two.
 */
@Slf4j
public class CapitalRouter {

    private final StrategyState state;
    private final AccountId self;
    private final AssetToken asset;
    private final YieldVenue venue;
    private final CompensationJournal compensations;

    public CapitalRouter(StrategyState state, AccountId self, AssetToken asset, YieldVenue venue,
                         CompensationJournal compensations) {
        this.state = state;
        this.self = self;
        this.asset = asset;
        this.venue = venue;
        this.compensations = compensations;
    }

    public BigInteger totalFloat() {
        return asset.balanceOf(self);
    }

    /**
     * Records {@code amount} as delegated, approves the venue for it and deposits it. The approval and the venue
     * position are journaled so a failing call can take them back.
     */
    public void delegate(BigInteger amount) {
        state.setTotalDelegatedHoldings(FixedPointMath.add(state.getTotalDelegatedHoldings(), amount));
        approveVenue(amount);
        compensations.record("revoke venue approval", () -> approveVenue(BigInteger.ZERO));

        BigInteger sharesBefore = venue.venueShareBalanceOf(self);
        venue.deposit(amount);
        BigInteger minted = venue.venueShareBalanceOf(self).subtract(sharesBefore);
        if (minted.signum() > 0) {
            compensations.record("withdraw " + minted + " venue shares", () -> venue.withdraw(minted));
        }
    }

    /**
     * Makes up to {@code amount} available as float, pulling the shortfall from the venue. Returns the amount
     * actually available, which is below {@code amount} when the venue pays back less than the shortfall.
     */
    public BigInteger retrieve(BigInteger amount) {
        BigInteger available = totalFloat();
        if (available.compareTo(amount) >= 0) {
            return amount;
        }
        BigInteger shortfall = amount.subtract(available);
        BigInteger venueShares = FixedPointMath.mulDivDown(shortfall, venue.totalSupply(), venue.balance());
        venue.withdraw(venueShares);
        BigInteger afterPull = totalFloat();
        BigInteger pulled = afterPull.subtract(available);
        if (pulled.signum() > 0) {
            compensations.record("return " + pulled + " to venue", () -> {
                approveVenue(pulled);
                venue.deposit(pulled);
            });
        }
        state.setTotalDelegatedHoldings(FixedPointMath.sub(state.getTotalDelegatedHoldings(), shortfall));

        BigInteger retrieved = FixedPointMath.min(afterPull, amount);
        if (retrieved.compareTo(amount) < 0) {
            log.warn("Venue short-paid: requested {}, available {}", amount, retrieved);
        }
        return retrieved;
    }

    /**
     * Pays {@code amount} of float to {@code to}.
     *
     * @throws StrategyException TRANSFER_FAILED when the asset refuses
     */
    public void payOut(AccountId to, BigInteger amount) {
        if (!asset.transfer(to, amount)) {
            throw new StrategyException(StrategyException.TRANSFER_FAILED,
                    "Asset refused transfer of " + amount + " to " + to);
        }
    }

    private void approveVenue(BigInteger amount) {
        if (!asset.approve(venue.id(), amount)) {
            throw new StrategyException(StrategyException.TRANSFER_FAILED,
                    "Asset refused approval of " + amount + " for venue " + venue.id());
        }
    }

    /**
     * Venue position valued at the venue's price per share, rounded up.
     */
    public BigInteger venueBalanceOfUnderlying() {
        return FixedPointMath.mulWadUp(venue.venueShareBalanceOf(self), venue.pricePerShare());
    }
}
