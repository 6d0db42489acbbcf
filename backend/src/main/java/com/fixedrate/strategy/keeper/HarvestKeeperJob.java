package com.fixedrate.strategy.keeper;

import com.fixedrate.domain.AccountId;
import com.fixedrate.strategy.StrategyException;
import com.fixedrate.strategy.engine.FixedRateStrategy;
import com.fixedrate.strategy.engine.HarvestReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Harvests as soon as the harvest delay has elapsed. A refused harvest is logged; the next poll tries again.
 */
@Component
@ConditionalOnProperty(prefix = "fixedrate.keeper", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class HarvestKeeperJob {

    private final FixedRateStrategy fixedRateStrategy;
    private final KeeperProperties keeperProperties;

    @Scheduled(
            fixedDelayString = "${fixedrate.keeper.poll-interval-ms:60000}",
            initialDelayString = "${fixedrate.keeper.poll-interval-ms:60000}")
    public void runScheduled() {
        if (!fixedRateStrategy.isHarvestDue()) {
            log.debug("Harvest not due until {}", fixedRateStrategy.nextHarvestAt());
            return;
        }
        AccountId keeper = AccountId.of(keeperProperties.getAddress());
        try {
            HarvestReport report = fixedRateStrategy.harvest(keeper);
            log.info("Keeper harvest done: fee shares {}, next harvest at {}",
                    report.feeShares(), report.harvestedAt() + report.harvestDelaySeconds());
        } catch (StrategyException e) {
            log.warn("Keeper harvest refused ({}): {}", e.getErrorCode(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Keeper harvest failed: {}", e.getMessage(), e);
        }
    }
}
