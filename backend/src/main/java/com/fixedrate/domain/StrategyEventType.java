package com.fixedrate.domain;

/**
 * Kind of change notification published by the engine.
 */
public enum StrategyEventType {
    INITIALIZED,
    DEPOSIT,
    WITHDRAWAL,
    HARVEST,
    PROFIT_CLAIMED,
    WITHDRAWAL_DELAY_UPDATED,
    HARVEST_DELAY_UPDATED,
    HARVEST_DELAY_UPDATE_SCHEDULED,
    FIXED_RATE_UPDATED
}
