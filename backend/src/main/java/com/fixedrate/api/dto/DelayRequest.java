package com.fixedrate.api.dto;

import jakarta.validation.constraints.NotNull;

/**
 * PUT /api/v1/strategy/settings/withdrawal-delay and /harvest-delay body.
 */
public record DelayRequest(@NotNull Long seconds) {
}
