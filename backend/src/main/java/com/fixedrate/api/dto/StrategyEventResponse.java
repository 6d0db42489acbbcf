package com.fixedrate.api.dto;

import java.time.Instant;
import java.util.Map;

/**
 * GET /api/v1/strategy/events item.
 */
public record StrategyEventResponse(
        String id,
        String type,
        String caller,
        Map<String, String> values,
        Instant occurredAt
) {
}
