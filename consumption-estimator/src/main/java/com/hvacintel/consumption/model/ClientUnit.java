package com.hvacintel.consumption.model;

import java.time.LocalDate;

/**
 * Row of the client unit roster.
 *
 * The install date is not stored in the roster: it lies {@code installOffsetDays + 1}
 * days before the automation start.
 */
public record ClientUnit(long unitId, String unitName, int installOffsetDays, LocalDate automationStartDate) {

    public LocalDate installDate() {
        return automationStartDate.minusDays(installOffsetDays + 1L);
    }
}
