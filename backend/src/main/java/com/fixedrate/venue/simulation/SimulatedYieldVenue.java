package com.fixedrate.venue.simulation;

import com.fixedrate.common.FixedPointMath;
import com.fixedrate.domain.AccountId;
import com.fixedrate.venue.VenueException;
import com.fixedrate.venue.YieldVenue;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

/**
 * In-process share-based vault over a {@link SimulatedToken}. Shares are minted pro rata to the asset it holds;
 * yield and losses are injected with {@link #accrueYield} and {@link #realizeLoss}, which move its asset balance
 * without touching share supply.
 */
@Slf4j
public class SimulatedYieldVenue {

    private final AccountId id;
    private final SimulatedToken token;
    private final Map<AccountId, BigInteger> shares = new HashMap<>();
    private BigInteger totalSupply = BigInteger.ZERO;

    public SimulatedYieldVenue(AccountId id, SimulatedToken token) {
        this.id = id;
        this.token = token;
    }

    public AccountId getId() {
        return id;
    }

    public synchronized BigInteger balance() {
        return token.balanceOf(id);
    }

    public synchronized BigInteger totalSupply() {
        return totalSupply;
    }

    public synchronized BigInteger pricePerShare() {
        if (totalSupply.signum() == 0) {
            return FixedPointMath.WAD;
        }
        return FixedPointMath.mulDivDown(balance(), FixedPointMath.WAD, totalSupply);
    }

    public synchronized BigInteger shareBalanceOf(AccountId owner) {
        return shares.getOrDefault(owner, BigInteger.ZERO);
    }

    public synchronized BigInteger deposit(AccountId depositor, BigInteger amount) {
        BigInteger pool = balance();
        BigInteger minted = totalSupply.signum() == 0 || pool.signum() == 0
                ? amount
                : FixedPointMath.mulDivDown(amount, totalSupply, pool);
        if (!token.transferFrom(id, depositor, id, amount)) {
            throw new VenueException("Asset transfer into venue refused for " + depositor);
        }
        shares.merge(depositor, minted, BigInteger::add);
        totalSupply = FixedPointMath.add(totalSupply, minted);
        log.debug("Venue {} deposit {} from {} -> {} shares", id, amount, depositor, minted);
        return minted;
    }

    public synchronized BigInteger withdraw(AccountId depositor, BigInteger shareAmount) {
        BigInteger held = shareBalanceOf(depositor);
        if (held.compareTo(shareAmount) < 0) {
            throw new VenueException("Insufficient venue shares for " + depositor + ": " + held + " < " + shareAmount);
        }
        BigInteger amount = totalSupply.signum() == 0
                ? BigInteger.ZERO
                : FixedPointMath.mulDivDown(shareAmount, balance(), totalSupply);
        shares.put(depositor, held.subtract(shareAmount));
        totalSupply = totalSupply.subtract(shareAmount);
        if (!token.transfer(id, depositor, amount)) {
            throw new VenueException("Asset transfer out of venue refused for " + depositor);
        }
        log.debug("Venue {} withdraw {} shares for {} -> {}", id, shareAmount, depositor, amount);
        return amount;
    }

    /** Adds asset to the venue out of thin air, raising the price per share. */
    public synchronized void accrueYield(BigInteger amount) {
        token.mint(id, amount);
        log.info("Venue {} accrued {} (balance now {})", id, amount, balance());
    }

    /** Removes asset from the venue, lowering the price per share. */
    public synchronized void realizeLoss(BigInteger amount) {
        if (!token.burn(id, amount)) {
            throw new VenueException("Loss " + amount + " exceeds venue balance " + balance());
        }
        log.info("Venue {} realized loss {} (balance now {})", id, amount, balance());
    }

    /**
     * Handle acting for {@code depositor}.
     */
    public YieldVenue connect(AccountId depositor) {
        return new YieldVenue() {
            @Override
            public AccountId id() {
                return id;
            }

            @Override
            public void deposit(BigInteger amount) {
                SimulatedYieldVenue.this.deposit(depositor, amount);
            }

            @Override
            public void withdraw(BigInteger shareAmount) {
                SimulatedYieldVenue.this.withdraw(depositor, shareAmount);
            }

            @Override
            public BigInteger balance() {
                return SimulatedYieldVenue.this.balance();
            }

            @Override
            public BigInteger totalSupply() {
                return SimulatedYieldVenue.this.totalSupply();
            }

            @Override
            public BigInteger pricePerShare() {
                return SimulatedYieldVenue.this.pricePerShare();
            }

            @Override
            public BigInteger venueShareBalanceOf(AccountId owner) {
                return SimulatedYieldVenue.this.shareBalanceOf(owner);
            }
        };
    }
}
