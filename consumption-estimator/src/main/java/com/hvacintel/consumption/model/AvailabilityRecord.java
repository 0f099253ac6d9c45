package com.hvacintel.consumption.model;

import java.time.LocalDate;

/**
 * Presence means the device reached the availability threshold on {@code date}.
 */
public record AvailabilityRecord(String deviceId, LocalDate date) {
}
