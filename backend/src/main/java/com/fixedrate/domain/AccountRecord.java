package com.fixedrate.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigInteger;

/**
 * Per-depositor ledger entry. lastDepositTimestamp (epoch seconds) is reset on every deposit and gates withdrawals.
 */
@NoArgsConstructor
@Getter
@Setter
public class AccountRecord {

    private BigInteger shareBalance = BigInteger.ZERO;
    private long lastDepositTimestamp;

    public AccountRecord copy() {
        AccountRecord copy = new AccountRecord();
        copy.shareBalance = shareBalance;
        copy.lastDepositTimestamp = lastDepositTimestamp;
        return copy;
    }
}
