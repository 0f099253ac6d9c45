package com.hvacintel.consumption.telemetry;

import com.hvacintel.consumption.config.EstimatorProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CalibrationFactorsTest {

    @Test
    @DisplayName("factorFor - longest matching prefix wins, default otherwise")
    void factorFor_LongestPrefix() {
        EstimatorProperties properties = new EstimatorProperties();
        properties.getCalibration().setDefaultFactor(310.94);
        properties.getCalibration().getFactors().put("DAC", 300.0);
        properties.getCalibration().getFactors().put("DAC4", 310.86);
        properties.getCalibration().getFactors().put("DAC403", 305.0);

        CalibrationFactors factors = new CalibrationFactors(properties);

        assertThat(factors.factorFor("DAC40324")).isEqualTo(305.0);
        assertThat(factors.factorFor("DAC41000")).isEqualTo(310.86);
        assertThat(factors.factorFor("DAC21000")).isEqualTo(300.0);
        assertThat(factors.factorFor("DUT10000")).isEqualTo(310.94);
        assertThat(factors.factorFor(null)).isEqualTo(310.94);
    }

    @Test
    @DisplayName("factorFor - no mapping configured")
    void factorFor_DefaultOnly() {
        CalibrationFactors factors = new CalibrationFactors(new EstimatorProperties());

        assertThat(factors.factorFor("DAC40324")).isEqualTo(310.94);
    }
}
