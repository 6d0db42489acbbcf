package com.fixedrate.venue;

import com.fixedrate.domain.AccountId;

import java.math.BigInteger;

/**
 * Yield-bearing destination for delegated capital, bound to the depositing engine. The engine only reads the
 * venue through these calls and makes no assumption about its internals.
 */
public interface YieldVenue {

    /** Address the engine approves as spender before {@link #deposit}. */
    AccountId id();

    /** Pulls {@code amount} of the asset from the bound depositor and credits venue shares. */
    void deposit(BigInteger amount);

    /** Burns {@code shareAmount} venue shares of the bound depositor and pays the asset back to it. */
    void withdraw(BigInteger shareAmount);

    /** Asset units the venue holds in total. */
    BigInteger balance();

    /** Venue shares outstanding. */
    BigInteger totalSupply();

    /** Asset value of one venue share, WAD-scaled. */
    BigInteger pricePerShare();

    BigInteger venueShareBalanceOf(AccountId owner);
}
