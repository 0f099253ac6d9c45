package com.hvacintel.consumption.model;

import java.time.LocalDateTime;

/**
 * Pre-aggregated consumption reading; the hour is taken from {@code recordTimestamp}.
 */
public record IndirectConsumptionRow(String deviceId, LocalDateTime recordTimestamp, double consumption) {
}
