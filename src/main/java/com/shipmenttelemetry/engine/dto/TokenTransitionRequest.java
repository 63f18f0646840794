package com.shipmenttelemetry.engine.dto;

import com.shipmenttelemetry.engine.token.TokenState;
import jakarta.validation.constraints.NotNull;

public record TokenTransitionRequest(@NotNull TokenState targetState) {
}
