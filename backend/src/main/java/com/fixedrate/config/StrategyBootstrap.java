package com.fixedrate.config;

import com.fixedrate.domain.AccountId;
import com.fixedrate.strategy.engine.FixedRateStrategy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

/**
 * Applies configured parameters as the owner once the application is up, then initializes the engine if asked to.
 * Harvest delay goes first: initialization refuses a zero delay.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StrategyBootstrap {

    private final FixedRateStrategy fixedRateStrategy;
    private final StrategyProperties strategyProperties;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (fixedRateStrategy.isInitialized()) {
            return;
        }
        AccountId owner = AccountId.of(strategyProperties.getOwner());
        fixedRateStrategy.setHarvestDelay(owner, strategyProperties.getHarvestDelaySeconds());
        fixedRateStrategy.setWithdrawalDelay(owner, strategyProperties.getWithdrawalDelaySeconds());
        fixedRateStrategy.setFixedRate(owner, new BigInteger(strategyProperties.getFixedRatePerSecond()));
        if (strategyProperties.isAutoInitialize()) {
            fixedRateStrategy.initialize(owner);
        }
        log.info("Strategy {} bootstrapped: harvest delay {}s, withdrawal delay {}s, rate {} per second, initialized {}",
                fixedRateStrategy.getAddress(), strategyProperties.getHarvestDelaySeconds(),
                strategyProperties.getWithdrawalDelaySeconds(), strategyProperties.getFixedRatePerSecond(),
                fixedRateStrategy.isInitialized());
    }
}
