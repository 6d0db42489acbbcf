package com.fixedrate.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Indexed copy of an engine change notification. Amounts are kept as decimal strings (uint256 does not fit Int64).
 */
@Document(collection = "strategy_events")
@CompoundIndex(name = "caller_occurred", def = "{'caller': 1, 'occurredAt': -1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class StrategyEventRecord {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String strategyAddress;
    private StrategyEventType type;
    private String caller;
    private Map<String, String> values = new LinkedHashMap<>();
    private Instant occurredAt;
    private Instant indexedAt;
}
