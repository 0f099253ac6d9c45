package com.hvacintel.consumption.model;

import java.time.LocalDate;

public record HourContribution(String deviceId, LocalDate date, int hourIndex, double current, double overlapSeconds) {
}
