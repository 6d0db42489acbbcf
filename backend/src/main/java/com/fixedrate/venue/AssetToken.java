package com.fixedrate.venue;

import com.fixedrate.domain.AccountId;

import java.math.BigInteger;

/**
 * Fungible asset handle bound to one caller: transfer and approve act on that caller's balance, transferFrom
 * spends that caller's allowance. A {@code false} result means the token refused the operation.
 */
public interface AssetToken {

    AccountId id();

    boolean transferFrom(AccountId from, AccountId to, BigInteger amount);

    boolean transfer(AccountId to, BigInteger amount);

    boolean approve(AccountId spender, BigInteger amount);

    BigInteger balanceOf(AccountId account);
}
