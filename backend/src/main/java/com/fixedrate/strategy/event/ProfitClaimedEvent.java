package com.fixedrate.strategy.event;

import com.fixedrate.domain.AccountId;
import com.fixedrate.domain.StrategyEventType;
import lombok.Getter;

import java.math.BigInteger;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Published after the fee account balance is redeemed and paid to the caller.
 */
@Getter
public class ProfitClaimedEvent extends StrategyEvent {

    private final BigInteger sharesRedeemed;
    private final BigInteger received;

    public ProfitClaimedEvent(Object source, AccountId strategy, AccountId caller, Instant occurredAt,
            BigInteger sharesRedeemed,
            BigInteger received) {
        super(source, strategy, caller, occurredAt);
        this.sharesRedeemed = sharesRedeemed;
        this.received = received;
    }

    @Override
    public StrategyEventType getType() {
        return StrategyEventType.PROFIT_CLAIMED;
    }

    @Override
    public Map<String, String> getValues() {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("sharesRedeemed", String.valueOf(sharesRedeemed));
        values.put("received", String.valueOf(received));
        return values;
    }
}
