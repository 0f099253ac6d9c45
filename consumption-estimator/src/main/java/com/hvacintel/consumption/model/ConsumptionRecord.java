package com.hvacintel.consumption.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Hourly consumption of one device, attributed to the unit that owns it.
 *
 * Unique per (deviceId, date, hour, method). After consolidation with the default
 * policy only one method remains per (deviceId, date, hour).
 */
@Value
@Builder(toBuilder = true)
public class ConsumptionRecord {

    long unitId;
    String deviceId;
    String deviceVersion;
    LocalDate date;
    /** Hour of day, 0-23 */
    int hour;
    double consumoKwh;
    LocalDate installDate;
    LocalDate automationStartDate;
    ConsumptionMethod method;
}
