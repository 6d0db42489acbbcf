package com.fixedrate.strategy.event;

import com.fixedrate.domain.AccountId;
import com.fixedrate.domain.StrategyEventType;
import lombok.Getter;

import java.math.BigInteger;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Published when the target rate per second changes.
 */
@Getter
public class FixedRateUpdatedEvent extends StrategyEvent {

    private final BigInteger fixedRatePerSecond;

    public FixedRateUpdatedEvent(Object source, AccountId strategy, AccountId caller, Instant occurredAt,
            BigInteger fixedRatePerSecond) {
        super(source, strategy, caller, occurredAt);
        this.fixedRatePerSecond = fixedRatePerSecond;
    }

    @Override
    public StrategyEventType getType() {
        return StrategyEventType.FIXED_RATE_UPDATED;
    }

    @Override
    public Map<String, String> getValues() {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("fixedRatePerSecond", String.valueOf(fixedRatePerSecond));
        return values;
    }
}
