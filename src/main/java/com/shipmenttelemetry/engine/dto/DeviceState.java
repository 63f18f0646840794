package com.shipmenttelemetry.engine.dto;

import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Last known facts about a device, used to fill fields a raw sample omits.
 *
 * @param batteryVoltage Last reported battery voltage
 * @param engineState    Last reported engine state
 * @param ignition       Last reported ignition state
 * @param zoneId         Zone of the device clock, applied to timestamps without an offset
 */
public record DeviceState(
    Double batteryVoltage,
    String engineState,
    Boolean ignition,
    ZoneId zoneId
) {

    public DeviceState {
        if (zoneId == null) {
            zoneId = ZoneOffset.UTC;
        }
    }

    public static DeviceState unknown() {
        return new DeviceState(null, null, null, ZoneOffset.UTC);
    }

    public static DeviceState fromLastKnown(NormalizedTelemetryRecord record) {
        return new DeviceState(record.batteryVoltage(), record.engineState(), record.ignition(), ZoneOffset.UTC);
    }
}
