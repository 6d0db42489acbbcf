package com.fixedrate.strategy.index;

import com.fixedrate.domain.StrategyEventRecord;
import com.fixedrate.domain.StrategyEventRecordRepository;
import com.fixedrate.strategy.event.StrategyEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;

/**
 * Persists every strategy event to strategy_events for the events API and dashboards. Runs on the indexer executor;
 * a storage failure is logged and never reaches the engine.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StrategyEventIndexer {

    public static final String INDEXER_EXECUTOR = "indexer-executor";

    private final StrategyEventRecordRepository strategyEventRecordRepository;
    private final Clock clock;

    @EventListener
    @Async(INDEXER_EXECUTOR)
    public void onStrategyEvent(StrategyEvent event) {
        StrategyEventRecord record = new StrategyEventRecord();
        record.setStrategyAddress(event.getStrategy().value());
        record.setType(event.getType());
        record.setCaller(event.getCaller() != null ? event.getCaller().value() : null);
        record.setValues(new LinkedHashMap<>(event.getValues()));
        record.setOccurredAt(event.getOccurredAt());
        record.setIndexedAt(Instant.now(clock));
        try {
            strategyEventRecordRepository.save(record);
            log.debug("Indexed {} event from {}", event.getType(), record.getCaller());
        } catch (Exception e) {
            log.error("Failed to index {} event from {}: {}", event.getType(), record.getCaller(), e.getMessage(), e);
        }
    }
}
