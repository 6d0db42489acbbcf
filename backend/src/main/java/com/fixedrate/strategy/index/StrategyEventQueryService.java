package com.fixedrate.strategy.index;

import com.fixedrate.domain.AccountId;
import com.fixedrate.domain.StrategyEventRecord;
import com.fixedrate.domain.StrategyEventRecordRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Newest-first read of indexed events for one strategy, optionally restricted to one caller.
 */
@Service
@RequiredArgsConstructor
public class StrategyEventQueryService {

    static final int DEFAULT_LIMIT = 50;
    static final int MAX_LIMIT = 500;

    private final StrategyEventRecordRepository strategyEventRecordRepository;

    public List<StrategyEventRecord> recent(AccountId strategy, AccountId caller, Integer limit) {
        int size = limit == null || limit <= 0 ? DEFAULT_LIMIT : Math.min(limit, MAX_LIMIT);
        PageRequest page = PageRequest.of(0, size);
        if (caller == null) {
            return strategyEventRecordRepository.findByStrategyAddressOrderByOccurredAtDesc(strategy.value(), page);
        }
        return strategyEventRecordRepository.findByStrategyAddressAndCallerOrderByOccurredAtDesc(
                strategy.value(), caller.value(), page);
    }
}
