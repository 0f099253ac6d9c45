package com.hvacintel.consumption.model;

import java.time.LocalDate;

public record TelemetryPayloadRow(String deviceId, LocalDate date, String payload) {
}
