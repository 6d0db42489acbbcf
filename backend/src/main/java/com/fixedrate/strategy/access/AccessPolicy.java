package com.fixedrate.strategy.access;

import com.fixedrate.domain.AccountId;
import com.fixedrate.domain.StrategyOperation;

/**
 * Authorization decision for privileged engine operations.
 */
public interface AccessPolicy {

    /**
     * May {@code caller} invoke {@code operation} now?
     */
    boolean canCall(AccountId caller, StrategyOperation operation);
}
