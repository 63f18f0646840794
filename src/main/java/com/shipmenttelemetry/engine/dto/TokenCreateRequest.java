package com.shipmenttelemetry.engine.dto;

import jakarta.validation.constraints.NotBlank;

import java.util.Map;

/**
 * @param tokenType        Type code, e.g. "QT-01"
 * @param parentShipmentId ST-01 root of the lineage
 * @param signature        Optional signature stored with the token
 */
public record TokenCreateRequest(
    @NotBlank String tokenType,
    @NotBlank String parentShipmentId,
    Map<String, Object> metadata,
    Map<String, String> relations,
    String signature
) {
}
