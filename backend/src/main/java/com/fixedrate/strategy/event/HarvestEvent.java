package com.fixedrate.strategy.event;

import com.fixedrate.domain.AccountId;
import com.fixedrate.domain.StrategyEventType;
import lombok.Getter;

import java.math.BigInteger;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Published after a harvest with the reconciled venue value and the fee shares minted for the surplus.
 */
@Getter
public class HarvestEvent extends StrategyEvent {

    private final BigInteger observedVenueValue;
    private final BigInteger realProfit;
    private final BigInteger expectedProfit;
    private final BigInteger surplus;
    private final BigInteger feeShares;
    private final BigInteger loss;
    private final long harvestDelaySeconds;

    public HarvestEvent(Object source, AccountId strategy, AccountId caller, Instant occurredAt,
            BigInteger observedVenueValue,
            BigInteger realProfit,
            BigInteger expectedProfit,
            BigInteger surplus,
            BigInteger feeShares,
            BigInteger loss,
            long harvestDelaySeconds) {
        super(source, strategy, caller, occurredAt);
        this.observedVenueValue = observedVenueValue;
        this.realProfit = realProfit;
        this.expectedProfit = expectedProfit;
        this.surplus = surplus;
        this.feeShares = feeShares;
        this.loss = loss;
        this.harvestDelaySeconds = harvestDelaySeconds;
    }

    @Override
    public StrategyEventType getType() {
        return StrategyEventType.HARVEST;
    }

    @Override
    public Map<String, String> getValues() {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("observedVenueValue", String.valueOf(observedVenueValue));
        values.put("realProfit", String.valueOf(realProfit));
        values.put("expectedProfit", String.valueOf(expectedProfit));
        values.put("surplus", String.valueOf(surplus));
        values.put("feeShares", String.valueOf(feeShares));
        values.put("loss", String.valueOf(loss));
        values.put("harvestDelaySeconds", String.valueOf(harvestDelaySeconds));
        return values;
    }
}
