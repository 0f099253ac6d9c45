package com.hvacintel.consumption.telemetry;

import com.hvacintel.consumption.model.Measurement;
import com.hvacintel.consumption.model.Span;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Lays measurements end to end on a running clock that starts at 0 for the day.
 *
 * Order is the payload order: span i+1 starts exactly where span i ends.
 */
@Component
public class SpanBuilder {

    public List<Span> build(String deviceId, LocalDate date, List<Measurement> measurements) {
        List<Span> spans = new ArrayList<>(measurements.size());
        double cumulativeEnd = 0.0;

        for (int i = 0; i < measurements.size(); i++) {
            Measurement m = measurements.get(i);
            double start = cumulativeEnd;
            cumulativeEnd = start + m.durationSeconds();
            spans.add(new Span(deviceId, date, i, m.current(), start, cumulativeEnd));
        }
        return spans;
    }
}
