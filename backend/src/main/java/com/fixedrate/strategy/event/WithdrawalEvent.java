package com.fixedrate.strategy.event;

import com.fixedrate.domain.AccountId;
import com.fixedrate.domain.StrategyEventType;
import lombok.Getter;

import java.math.BigInteger;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Published after a withdrawal. received may be below requested when the venue short-pays.
 */
@Getter
public class WithdrawalEvent extends StrategyEvent {

    private final BigInteger requested;
    private final BigInteger sharesBurned;
    private final BigInteger received;

    public WithdrawalEvent(Object source, AccountId strategy, AccountId caller, Instant occurredAt,
            BigInteger requested,
            BigInteger sharesBurned,
            BigInteger received) {
        super(source, strategy, caller, occurredAt);
        this.requested = requested;
        this.sharesBurned = sharesBurned;
        this.received = received;
    }

    @Override
    public StrategyEventType getType() {
        return StrategyEventType.WITHDRAWAL;
    }

    @Override
    public Map<String, String> getValues() {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("requested", String.valueOf(requested));
        values.put("sharesBurned", String.valueOf(sharesBurned));
        values.put("received", String.valueOf(received));
        return values;
    }
}
