package com.fixedrate.strategy.event;

import com.fixedrate.domain.AccountId;
import com.fixedrate.domain.StrategyEventType;
import lombok.Getter;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Published when the withdrawal delay changes.
 */
@Getter
public class WithdrawalDelayUpdatedEvent extends StrategyEvent {

    private final long withdrawalDelaySeconds;

    public WithdrawalDelayUpdatedEvent(Object source, AccountId strategy, AccountId caller, Instant occurredAt,
            long withdrawalDelaySeconds) {
        super(source, strategy, caller, occurredAt);
        this.withdrawalDelaySeconds = withdrawalDelaySeconds;
    }

    @Override
    public StrategyEventType getType() {
        return StrategyEventType.WITHDRAWAL_DELAY_UPDATED;
    }

    @Override
    public Map<String, String> getValues() {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("withdrawalDelaySeconds", String.valueOf(withdrawalDelaySeconds));
        return values;
    }
}
