package com.fixedrate.strategy.event;

import com.fixedrate.domain.AccountId;
import com.fixedrate.domain.StrategyEventType;
import lombok.Getter;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Published when a harvest delay change is staged until the next harvest.
 */
@Getter
public class HarvestDelayUpdateScheduledEvent extends StrategyEvent {

    private final long pendingHarvestDelaySeconds;

    public HarvestDelayUpdateScheduledEvent(Object source, AccountId strategy, AccountId caller, Instant occurredAt,
            long pendingHarvestDelaySeconds) {
        super(source, strategy, caller, occurredAt);
        this.pendingHarvestDelaySeconds = pendingHarvestDelaySeconds;
    }

    @Override
    public StrategyEventType getType() {
        return StrategyEventType.HARVEST_DELAY_UPDATE_SCHEDULED;
    }

    @Override
    public Map<String, String> getValues() {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("pendingHarvestDelaySeconds", String.valueOf(pendingHarvestDelaySeconds));
        return values;
    }
}
