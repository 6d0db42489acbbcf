package com.fixedrate.strategy.engine;

import com.fixedrate.common.FixedPointMath;
import com.fixedrate.domain.AccountId;
import com.fixedrate.domain.AccountRecord;
import com.fixedrate.domain.StrategyState;
import com.fixedrate.strategy.StrategyException;

import java.math.BigInteger;

/**
 * Share supply and per-account balances, and conversion between shares and asset units.
 * <p>
 * Conversions that hand out shares or assets round down; the conversion that takes shares back for a requested
 * asset amount rounds up. Both directions favour the pool, so repeated rounding can never drain it below the sum
 * of legitimate claims.
 */
public class ShareLedger {

    private final StrategyState state;
    private final CapitalRouter capitalRouter;

    public ShareLedger(StrategyState state, CapitalRouter capitalRouter) {
        this.state = state;
        this.capitalRouter = capitalRouter;
    }

    /** Idle float plus the asset recorded as delegated to the venue. */
    public BigInteger totalHoldings() {
        return FixedPointMath.add(capitalRouter.totalFloat(), state.getTotalDelegatedHoldings());
    }

    /**
     * Shares worth {@code assetAmount}, rounded down. 1:1 while supply is zero.
     */
    public BigInteger sharesForAssets(BigInteger assetAmount) {
        BigInteger supply = state.getTotalShares();
        if (supply.signum() == 0) {
            return assetAmount;
        }
        return FixedPointMath.mulDivDown(assetAmount, supply, totalHoldings());
    }

    /**
     * Asset value of {@code shareAmount}, rounded down. 1:1 while supply is zero.
     */
    public BigInteger assetsForShares(BigInteger shareAmount) {
        BigInteger supply = state.getTotalShares();
        if (supply.signum() == 0) {
            return shareAmount;
        }
        return FixedPointMath.mulDivDown(shareAmount, totalHoldings(), supply);
    }

    /**
     * Shares to burn for a withdrawal of {@code assetAmount}, rounded up.
     */
    public BigInteger sharesToBurn(BigInteger assetAmount) {
        BigInteger supply = state.getTotalShares();
        if (supply.signum() == 0) {
            return assetAmount;
        }
        return FixedPointMath.mulDivUp(assetAmount, supply, totalHoldings());
    }

    public BigInteger balanceOf(AccountId account) {
        return state.shareBalanceOf(account);
    }

    public void mint(AccountId account, BigInteger shares) {
        state.setTotalShares(FixedPointMath.add(state.getTotalShares(), shares));
        AccountRecord record = state.account(account);
        record.setShareBalance(FixedPointMath.add(record.getShareBalance(), shares));
    }

    public void burn(AccountId account, BigInteger shares) {
        BigInteger balance = state.shareBalanceOf(account);
        if (balance.compareTo(shares) < 0) {
            throw new StrategyException(StrategyException.INSUFFICIENT_SHARES,
                    "Account " + account + " holds " + balance + " shares, needs " + shares);
        }
        state.account(account).setShareBalance(balance.subtract(shares));
        state.setTotalShares(FixedPointMath.sub(state.getTotalShares(), shares));
    }
}
