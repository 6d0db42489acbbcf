package com.fixedrate.domain;

import com.fixedrate.common.FixedPointMath;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

import java.math.BigInteger;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Mutable accounting state of one engine instance (one asset, one venue). Amounts are uint256 asset or share
 * units; timestamps and delays are seconds. totalShares starts at the uint256 sentinel until initialization.
 */
@Getter
@Setter
public class StrategyState {

    private BigInteger totalShares = FixedPointMath.MAX_UINT256;
    private BigInteger totalDelegatedHoldings = BigInteger.ZERO;
    private boolean initialized;
    private long withdrawalDelaySeconds;
    private long harvestDelaySeconds;
    private long pendingHarvestDelaySeconds;
    private long lastHarvestTimestamp;
    /** Target growth per second, WAD-scaled (1e18 == 100%). */
    private BigInteger fixedRatePerSecond = BigInteger.ZERO;

    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private final Map<AccountId, AccountRecord> accounts = new HashMap<>();

    /**
     * Existing record, or a fresh empty one registered for the account.
     */
    public AccountRecord account(AccountId id) {
        return accounts.computeIfAbsent(id, k -> new AccountRecord());
    }

    public BigInteger shareBalanceOf(AccountId id) {
        AccountRecord record = accounts.get(id);
        return record != null ? record.getShareBalance() : BigInteger.ZERO;
    }

    public long lastDepositTimestampOf(AccountId id) {
        AccountRecord record = accounts.get(id);
        return record != null ? record.getLastDepositTimestamp() : 0L;
    }

    public Map<AccountId, AccountRecord> accountsView() {
        return Collections.unmodifiableMap(accounts);
    }

    /**
     * Deep copy used as the rollback point of a mutating call.
     */
    public StrategyState copy() {
        StrategyState copy = new StrategyState();
        copy.restoreFrom(this);
        return copy;
    }

    public void restoreFrom(StrategyState other) {
        this.totalShares = other.totalShares;
        this.totalDelegatedHoldings = other.totalDelegatedHoldings;
        this.initialized = other.initialized;
        this.withdrawalDelaySeconds = other.withdrawalDelaySeconds;
        this.harvestDelaySeconds = other.harvestDelaySeconds;
        this.pendingHarvestDelaySeconds = other.pendingHarvestDelaySeconds;
        this.lastHarvestTimestamp = other.lastHarvestTimestamp;
        this.fixedRatePerSecond = other.fixedRatePerSecond;
        this.accounts.clear();
        other.accounts.forEach((id, record) -> this.accounts.put(id, record.copy()));
    }
}
