package com.hvacintel.consumption.telemetry;

import com.hvacintel.consumption.config.EstimatorProperties;
import com.hvacintel.consumption.model.HourlyEnergy;
import com.hvacintel.consumption.model.TelemetryPayloadRow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DirectConsumptionCalculatorTest {

    private static final LocalDate DAY = LocalDate.of(2025, 1, 15);

    private DirectConsumptionCalculator calculator;

    @BeforeEach
    void setUp() {
        EstimatorProperties properties = new EstimatorProperties();
        properties.getCalibration().getFactors().put("DAC4", 300.0);
        calculator = new DirectConsumptionCalculator(
                new PayloadParser(properties),
                new SpanBuilder(),
                new HourBucketDistributor(),
                new EnergyAggregator(),
                new CalibrationFactors(properties));
    }

    @Test
    @DisplayName("compute - decodes a payload into hourly kWh")
    void compute_SinglePayload() {
        EnergyAggregator.Result result = calculator.compute("DAC40324",
                List.of(new TelemetryPayloadRow("DAC40324A1", DAY, "5,3*2,*9,2*0")));

        assertThat(result.energies()).containsExactly(new HourlyEnergy("DAC40324A1", DAY, 0, 0.000917));
    }

    @Test
    @DisplayName("compute - rows of the same device-day share one clock")
    void compute_RowsConcatenated() {
        // 10A for 3000s, then 10A for 1200s: the second row starts at 3000s, not 0
        EnergyAggregator.Result result = calculator.compute("DAC40324", List.of(
                new TelemetryPayloadRow("DAC40324A1", DAY, "10*3000"),
                new TelemetryPayloadRow("DAC40324A1", DAY, "10*1200")));

        assertThat(result.energies()).extracting(HourlyEnergy::hour).containsExactly(0, 1);
        // hour 0: 300 * 10 * 3600/3600 / 1000 ; hour 1: 300 * 10 * 600/3600 / 1000
        assertThat(result.energies()).extracting(HourlyEnergy::consumoKwh).containsExactly(3.0, 0.5);
    }

    @Test
    @DisplayName("compute - separate devices and days keep separate clocks")
    void compute_SeparateClocks() {
        EnergyAggregator.Result result = calculator.compute("DAC40324", List.of(
                new TelemetryPayloadRow("DAC40324A1", DAY, "1*3600"),
                new TelemetryPayloadRow("DAC40324A1", DAY.plusDays(1), "1*3600"),
                new TelemetryPayloadRow("DAC40324B2", DAY, "1*3600")));

        assertThat(result.energies()).extracting(HourlyEnergy::hour).containsOnly(0);
        assertThat(result.energies()).hasSize(3);
    }

    @Test
    @DisplayName("compute - payload longer than a day reports discarded buckets")
    void compute_OverlongPayload() {
        EnergyAggregator.Result result = calculator.compute("DAC40324",
                List.of(new TelemetryPayloadRow("DAC40324A1", DAY, "1*86400,1*7200")));

        assertThat(result.energies()).hasSize(24);
        assertThat(result.discardedHourBuckets()).isEqualTo(2);
    }

    @Test
    @DisplayName("compute - token with a huge duration fills the day without aborting")
    void compute_HugeDuration() {
        EnergyAggregator.Result result = calculator.compute("DAC40324",
                List.of(new TelemetryPayloadRow("DAC40324A1", DAY, "5,1*1e20")));

        assertThat(result.energies()).hasSize(24);
        // hour 0: 5A for 1s plus 1A for 3599s
        assertThat(result.energies().get(0).consumoKwh()).isEqualTo(0.300333);
        assertThat(result.discardedHourBuckets()).isGreaterThan(Integer.MAX_VALUE);
    }

    @Test
    @DisplayName("compute - token with a huge current drops its hour, keeps the rest")
    void compute_HugeCurrent() {
        EnergyAggregator.Result result = calculator.compute("DAC40324", List.of(
                new TelemetryPayloadRow("DAC40324A1", DAY, "5,1e308"),
                new TelemetryPayloadRow("DAC40324B2", DAY, "10*3600")));

        assertThat(result.energies()).containsExactly(new HourlyEnergy("DAC40324B2", DAY, 0, 3.0));
        assertThat(result.discardedHourBuckets()).isEqualTo(1);
    }

    @Test
    @DisplayName("compute - null and empty payloads produce nothing")
    void compute_Empty() {
        EnergyAggregator.Result result = calculator.compute("DAC40324", List.of(
                new TelemetryPayloadRow("DAC40324A1", DAY, null),
                new TelemetryPayloadRow("DAC40324A1", DAY, "")));

        assertThat(result.energies()).isEmpty();
        assertThat(result.discardedHourBuckets()).isZero();
    }
}
