package com.hvacintel.consumption.model;

import java.time.LocalDate;

/**
 * Period during which a device's consumption is attributed to its unit, bounds inclusive.
 */
public record UnitDeviceWindow(long unitId,
                               String deviceId,
                               String deviceVersion,
                               LocalDate installDate,
                               LocalDate automationStartDate) {

    public boolean contains(LocalDate date) {
        return date != null && !date.isBefore(installDate) && !date.isAfter(automationStartDate);
    }
}
