package com.hvacintel.consumption.telemetry;

import com.hvacintel.consumption.config.EstimatorProperties;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Resolves the current-to-power factor K of a device version.
 *
 * Configured per family prefix, e.g. {@code DAC4: 310.94}; the longest prefix matching
 * the version wins and unmatched versions get the default factor.
 */
@Component
public class CalibrationFactors {

    private final double defaultFactor;
    private final Map<String, Double> factors;

    public CalibrationFactors(EstimatorProperties properties) {
        this.defaultFactor = properties.getCalibration().getDefaultFactor();
        this.factors = Map.copyOf(properties.getCalibration().getFactors());
    }

    public double factorFor(String deviceVersion) {
        if (deviceVersion == null) return defaultFactor;

        String bestPrefix = null;
        for (String prefix : factors.keySet()) {
            if (deviceVersion.startsWith(prefix)
                    && (bestPrefix == null || prefix.length() > bestPrefix.length())) {
                bestPrefix = prefix;
            }
        }
        return bestPrefix == null ? defaultFactor : factors.get(bestPrefix);
    }
}
