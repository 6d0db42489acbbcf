package com.fixedrate.domain;

/**
 * Engine entry points subject to an authorization decision.
 */
public enum StrategyOperation {
    INITIALIZE,
    HARVEST,
    CLAIM_PROFIT,
    SET_WITHDRAWAL_DELAY,
    SET_HARVEST_DELAY,
    SET_FIXED_RATE
}
