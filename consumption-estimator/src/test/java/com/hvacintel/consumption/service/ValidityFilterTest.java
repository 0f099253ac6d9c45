package com.hvacintel.consumption.service;

import com.hvacintel.consumption.model.AvailabilityRecord;
import com.hvacintel.consumption.model.ConsumptionMethod;
import com.hvacintel.consumption.model.ConsumptionRecord;
import com.hvacintel.consumption.model.UnitDeviceWindow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ValidityFilterTest {

    private static final LocalDate INSTALL = LocalDate.of(2025, 1, 10);
    private static final LocalDate AUTOMATION = LocalDate.of(2025, 1, 20);

    private final UnitDeviceWindow window =
            new UnitDeviceWindow(1L, "DAC40324A1", "DAC40324", INSTALL, AUTOMATION);

    private ConsumptionRecord record(String deviceId, LocalDate date) {
        return ConsumptionRecord.builder()
                .unitId(1L).deviceId(deviceId).deviceVersion("DAC40324")
                .date(date).hour(3).consumoKwh(1.5)
                .installDate(INSTALL).automationStartDate(AUTOMATION)
                .method(ConsumptionMethod.DIRECT)
                .build();
    }

    @Test
    @DisplayName("accepts - record after automation start is rejected even when available")
    void accepts_OutsideWindow() {
        LocalDate late = LocalDate.of(2025, 1, 25);
        ValidityFilter filter = new ValidityFilter(List.of(window), List.of(new AvailabilityRecord("DAC40324A1", late)));

        assertThat(filter.accepts(record("DAC40324A1", late))).isFalse();
    }

    @Test
    @DisplayName("accepts - window bounds are inclusive")
    void accepts_InclusiveBounds() {
        ValidityFilter filter = new ValidityFilter(List.of(window), List.of(
                new AvailabilityRecord("DAC40324A1", INSTALL),
                new AvailabilityRecord("DAC40324A1", AUTOMATION)));

        assertThat(filter.accepts("DAC40324A1", INSTALL)).isTrue();
        assertThat(filter.accepts("DAC40324A1", AUTOMATION)).isTrue();
        assertThat(filter.withinWindow("DAC40324A1", INSTALL.minusDays(1))).isFalse();
    }

    @Test
    @DisplayName("accepts - inside the window but below the availability threshold")
    void accepts_NotAvailable() {
        LocalDate day = LocalDate.of(2025, 1, 15);
        ValidityFilter filter = new ValidityFilter(List.of(window), List.of());

        assertThat(filter.withinWindow("DAC40324A1", day)).isTrue();
        assertThat(filter.accepts("DAC40324A1", day)).isFalse();
    }

    @Test
    @DisplayName("accepts - device without a window is rejected")
    void accepts_UnknownDevice() {
        LocalDate day = LocalDate.of(2025, 1, 15);
        ValidityFilter filter = new ValidityFilter(List.of(window), List.of(new AvailabilityRecord("DAC99999Z9", day)));

        assertThat(filter.windowFor("DAC99999Z9")).isEmpty();
        assertThat(filter.accepts("DAC99999Z9", day)).isFalse();
    }

    @Test
    @DisplayName("apply - keeps only valid records, in order")
    void apply_FiltersCollection() {
        LocalDate d1 = LocalDate.of(2025, 1, 12);
        LocalDate d2 = LocalDate.of(2025, 1, 13);
        ValidityFilter filter = new ValidityFilter(List.of(window), List.of(
                new AvailabilityRecord("DAC40324A1", d1),
                new AvailabilityRecord("DAC40324A1", d2)));

        List<ConsumptionRecord> kept = filter.apply(List.of(
                record("DAC40324A1", d2),
                record("DAC40324A1", LocalDate.of(2025, 1, 14)),
                record("DAC40324A1", d1)));

        assertThat(kept).extracting(ConsumptionRecord::getDate).containsExactly(d2, d1);
    }
}
