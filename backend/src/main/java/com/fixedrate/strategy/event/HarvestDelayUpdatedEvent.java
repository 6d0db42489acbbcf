package com.fixedrate.strategy.event;

import com.fixedrate.domain.AccountId;
import com.fixedrate.domain.StrategyEventType;
import lombok.Getter;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Published when a harvest delay becomes active (first setting, or a staged one rolled over by harvest).
 */
@Getter
public class HarvestDelayUpdatedEvent extends StrategyEvent {

    private final long harvestDelaySeconds;

    public HarvestDelayUpdatedEvent(Object source, AccountId strategy, AccountId caller, Instant occurredAt,
            long harvestDelaySeconds) {
        super(source, strategy, caller, occurredAt);
        this.harvestDelaySeconds = harvestDelaySeconds;
    }

    @Override
    public StrategyEventType getType() {
        return StrategyEventType.HARVEST_DELAY_UPDATED;
    }

    @Override
    public Map<String, String> getValues() {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("harvestDelaySeconds", String.valueOf(harvestDelaySeconds));
        return values;
    }
}
