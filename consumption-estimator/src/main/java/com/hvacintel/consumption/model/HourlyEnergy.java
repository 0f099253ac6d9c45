package com.hvacintel.consumption.model;

import java.time.LocalDate;

/**
 * Direct-method energy of one device-hour, before it is attributed to a unit.
 */
public record HourlyEnergy(String deviceId, LocalDate date, int hour, double consumoKwh) {
}
