package com.hvacintel.consumption.service;

import com.hvacintel.consumption.config.EstimatorProperties;
import com.hvacintel.consumption.config.EstimatorProperties.Attribution.ConsolidationPolicy;
import com.hvacintel.consumption.model.ConsumptionMethod;
import com.hvacintel.consumption.model.ConsumptionRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ConsumptionConsolidatorTest {

    private static final LocalDate DAY = LocalDate.of(2025, 1, 15);

    private ConsumptionConsolidator consolidator(ConsolidationPolicy policy) {
        EstimatorProperties properties = new EstimatorProperties();
        properties.getAttribution().setConsolidationPolicy(policy);
        return new ConsumptionConsolidator(properties);
    }

    private ConsumptionRecord record(long unitId, String deviceId, int hour, double kwh, ConsumptionMethod method) {
        return ConsumptionRecord.builder()
                .unitId(unitId).deviceId(deviceId).deviceVersion(deviceId.substring(0, 8))
                .date(DAY).hour(hour).consumoKwh(kwh)
                .method(method)
                .build();
    }

    @Test
    @DisplayName("consolidate - PREFER_DIRECT drops the indirect duplicate and counts it")
    void consolidate_PreferDirect() {
        ConsumptionRecord direct = record(1, "DAC40324A1", 5, 2.0, ConsumptionMethod.DIRECT);
        ConsumptionRecord duplicate = record(1, "DAC40324A1", 5, 1.7, ConsumptionMethod.INDIRECT);
        ConsumptionRecord indirectOnly = record(1, "DAC40324A1", 6, 1.1, ConsumptionMethod.INDIRECT);

        ConsumptionConsolidator.Result result = consolidator(ConsolidationPolicy.PREFER_DIRECT)
                .consolidate(List.of(direct), List.of(duplicate, indirectOnly));

        assertThat(result.records()).containsExactly(direct, indirectOnly);
        assertThat(result.duplicatesResolved()).isEqualTo(1);
    }

    @Test
    @DisplayName("consolidate - KEEP_BOTH keeps both methods for the same device-hour")
    void consolidate_KeepBoth() {
        ConsumptionRecord direct = record(1, "DAC40324A1", 5, 2.0, ConsumptionMethod.DIRECT);
        ConsumptionRecord indirect = record(1, "DAC40324A1", 5, 1.7, ConsumptionMethod.INDIRECT);

        ConsumptionConsolidator.Result result = consolidator(ConsolidationPolicy.KEEP_BOTH)
                .consolidate(List.of(direct), List.of(indirect));

        assertThat(result.records()).containsExactly(direct, indirect);
        assertThat(result.duplicatesResolved()).isZero();
    }

    @Test
    @DisplayName("consolidate - output sorted by unit, date, hour, method, device")
    void consolidate_Sorted() {
        ConsumptionRecord a = record(2, "DAC40324A1", 0, 1, ConsumptionMethod.DIRECT);
        ConsumptionRecord b = record(1, "DUT10000C3", 3, 1, ConsumptionMethod.INDIRECT);
        ConsumptionRecord c = record(1, "DAC40324B2", 3, 1, ConsumptionMethod.DIRECT);
        ConsumptionRecord d = record(1, "DAC40324A1", 3, 1, ConsumptionMethod.DIRECT);

        ConsumptionConsolidator.Result result = consolidator(ConsolidationPolicy.PREFER_DIRECT)
                .consolidate(List.of(a, c, d), List.of(b));

        assertThat(result.records()).containsExactly(d, c, b, a);
    }

    @Test
    @DisplayName("consolidate - every direct device-hour is kept exactly once")
    void consolidate_NoDirectLost() {
        List<ConsumptionRecord> direct = List.of(
                record(1, "DAC40324A1", 0, 1, ConsumptionMethod.DIRECT),
                record(1, "DAC40324A1", 1, 1, ConsumptionMethod.DIRECT));

        ConsumptionConsolidator.Result result = consolidator(ConsolidationPolicy.PREFER_DIRECT)
                .consolidate(direct, List.of());

        assertThat(result.records()).containsExactlyElementsOf(direct);
    }
}
