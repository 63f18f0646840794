package com.shipmenttelemetry.engine.model;

public enum FlagSeverity {
    INFO,
    WARNING,
    CRITICAL
}
