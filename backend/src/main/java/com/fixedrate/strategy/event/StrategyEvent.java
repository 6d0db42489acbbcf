package com.fixedrate.strategy.event;

import com.fixedrate.domain.AccountId;
import com.fixedrate.domain.StrategyEventType;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

import java.time.Instant;
import java.util.Map;

/**
 * Change notification published after a state-changing engine call commits. Observability only: nothing in the
 * engine depends on who listens. Source is the engine instance.
 */
@Getter
public abstract class StrategyEvent extends ApplicationEvent {

    private final AccountId strategy;
    private final AccountId caller;
    private final Instant occurredAt;

    protected StrategyEvent(Object source, AccountId strategy, AccountId caller, Instant occurredAt) {
        super(source);
        this.strategy = strategy;
        this.caller = caller;
        this.occurredAt = occurredAt;
    }

    public abstract StrategyEventType getType();

    /** Changed values keyed by name, amounts as decimal strings. */
    public abstract Map<String, String> getValues();
}
