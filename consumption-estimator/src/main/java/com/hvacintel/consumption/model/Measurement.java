package com.hvacintel.consumption.model;

/**
 * One decoded telemetry token: a current reading held for {@code durationSeconds}.
 */
public record Measurement(double current, double durationSeconds) {
}
