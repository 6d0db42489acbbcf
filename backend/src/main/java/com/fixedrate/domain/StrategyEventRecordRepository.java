package com.fixedrate.domain;

import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * Persistence for strategy_events. Written by the event indexer, read by the events API.
 */
public interface StrategyEventRecordRepository extends MongoRepository<StrategyEventRecord, String> {

    List<StrategyEventRecord> findByStrategyAddressOrderByOccurredAtDesc(String strategyAddress, Pageable pageable);

    List<StrategyEventRecord> findByStrategyAddressAndCallerOrderByOccurredAtDesc(
            String strategyAddress, String caller, Pageable pageable);
}
