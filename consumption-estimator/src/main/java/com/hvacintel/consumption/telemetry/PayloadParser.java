package com.hvacintel.consumption.telemetry;

import com.hvacintel.consumption.config.EstimatorProperties;
import com.hvacintel.consumption.model.Measurement;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Decodes a device-day current payload into ordered measurements.
 *
 * Payload format: comma-separated tokens, each {@code current} or {@code current*seconds}.
 * e.g. "5,3*2,*9,2*0" → (5A for 1s), (3A for 2s)
 *
 * Parsing is permissive: tokens starting with the ignore marker, tokens whose current
 * is not a number and tokens with a non-positive duration are skipped, never rejected.
 * A missing or non-numeric duration counts as one second.
 */
@Component
@Slf4j
public class PayloadParser {

    private static final String TOKEN_SEPARATOR = ",";
    private static final Pattern DURATION_SEPARATOR = Pattern.compile("\\*");
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");
    private static final double DEFAULT_DURATION_SECONDS = 1.0;

    private final String ignoreMarker;

    public PayloadParser(EstimatorProperties properties) {
        this.ignoreMarker = properties.getTelemetry().getIgnoreMarker();
    }

    public List<Measurement> parse(String payload) {
        if (payload == null || payload.isBlank()) return List.of();

        String[] tokens = payload.split(TOKEN_SEPARATOR);
        List<Measurement> measurements = new ArrayList<>(tokens.length);
        int skipped = 0;

        for (String raw : tokens) {
            String token = raw.trim();
            if (token.isEmpty() || isIgnored(token)) {
                skipped++;
                continue;
            }

            String[] parts = DURATION_SEPARATOR.split(token, -1);
            Double current = parseDecimal(parts[0]);
            if (current == null) {
                skipped++;
                continue;
            }

            Double duration = parts.length > 1 ? parseDecimal(parts[1]) : null;
            double seconds = duration != null ? duration : DEFAULT_DURATION_SECONDS;
            if (seconds <= 0) {
                skipped++;
                continue;
            }

            measurements.add(new Measurement(current, seconds));
        }

        if (skipped > 0) {
            log.trace("Payload decoded: {} measurements, {} tokens skipped", measurements.size(), skipped);
        }
        return measurements;
    }

    private boolean isIgnored(String token) {
        return ignoreMarker != null && !ignoreMarker.isEmpty() && token.startsWith(ignoreMarker);
    }

    private Double parseDecimal(String val) {
        if (val == null) return null;
        String trimmed = val.trim();
        if (!DECIMAL.matcher(trimmed).matches()) return null;
        try {
            double parsed = Double.parseDouble(trimmed);
            return Double.isFinite(parsed) ? parsed : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
