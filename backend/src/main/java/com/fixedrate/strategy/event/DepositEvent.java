package com.fixedrate.strategy.event;

import com.fixedrate.domain.AccountId;
import com.fixedrate.domain.StrategyEventType;
import lombok.Getter;

import java.math.BigInteger;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Published after a deposit: asset pulled from the caller, shares credited, funds delegated.
 */
@Getter
public class DepositEvent extends StrategyEvent {

    private final BigInteger amount;
    private final BigInteger shares;

    public DepositEvent(Object source, AccountId strategy, AccountId caller, Instant occurredAt,
            BigInteger amount,
            BigInteger shares) {
        super(source, strategy, caller, occurredAt);
        this.amount = amount;
        this.shares = shares;
    }

    @Override
    public StrategyEventType getType() {
        return StrategyEventType.DEPOSIT;
    }

    @Override
    public Map<String, String> getValues() {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("amount", String.valueOf(amount));
        values.put("shares", String.valueOf(shares));
        return values;
    }
}
