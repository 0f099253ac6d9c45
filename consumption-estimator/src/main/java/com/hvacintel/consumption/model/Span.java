package com.hvacintel.consumption.model;

import java.time.LocalDate;

/**
 * Interval {@code [startSec, endSec)} of constant current, in seconds since the start of {@code date}.
 */
public record Span(String deviceId, LocalDate date, int index, double current, double startSec, double endSec) {

    public double durationSeconds() {
        return endSec - startSec;
    }
}
