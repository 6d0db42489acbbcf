package com.fixedrate.strategy.access;

import com.fixedrate.domain.AccountId;
import com.fixedrate.domain.StrategyOperation;

import java.util.Objects;
import java.util.Set;

/**
 * Single owner may call every privileged operation; keepers may additionally call {@link StrategyOperation#HARVEST}.
 */
public class OwnerAccessPolicy implements AccessPolicy {

    private final AccountId owner;
    private final Set<AccountId> keepers;

    public OwnerAccessPolicy(AccountId owner, Set<AccountId> keepers) {
        this.owner = Objects.requireNonNull(owner, "owner must not be null");
        this.keepers = keepers != null ? Set.copyOf(keepers) : Set.of();
    }

    @Override
    public boolean canCall(AccountId caller, StrategyOperation operation) {
        if (caller == null) {
            return false;
        }
        if (owner.equals(caller)) {
            return true;
        }
        return operation == StrategyOperation.HARVEST && keepers.contains(caller);
    }
}
