package com.fixedrate.strategy.event;

import com.fixedrate.domain.AccountId;
import com.fixedrate.domain.StrategyEventType;
import lombok.Getter;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Published once, when the engine opens for deposits and starts the harvest clock.
 */
@Getter
public class InitializedEvent extends StrategyEvent {

    private final long harvestClockStart;

    public InitializedEvent(Object source, AccountId strategy, AccountId caller, Instant occurredAt,
            long harvestClockStart) {
        super(source, strategy, caller, occurredAt);
        this.harvestClockStart = harvestClockStart;
    }

    @Override
    public StrategyEventType getType() {
        return StrategyEventType.INITIALIZED;
    }

    @Override
    public Map<String, String> getValues() {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("harvestClockStart", String.valueOf(harvestClockStart));
        return values;
    }
}
