package com.hvacintel.consumption.telemetry;

import com.hvacintel.consumption.model.HourContribution;
import com.hvacintel.consumption.model.Span;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits each span across the clock hours of its day.
 *
 * The hour range runs from floor(start / 3600) to ceil(end / 3600) - 1, so the overlaps
 * of one span always add up to its duration. Only hours 0-23 become contributions; the
 * hours past the end of the day are counted, not emitted.
 */
@Component
public class HourBucketDistributor {

    public static final int SECONDS_PER_HOUR = 3600;

    public record Distribution(List<HourContribution> contributions, long discardedHours) {
    }

    public Distribution distribute(List<Span> spans) {
        List<HourContribution> contributions = new ArrayList<>(spans.size());
        long discarded = 0;
        for (Span span : spans) {
            Distribution d = distribute(span);
            contributions.addAll(d.contributions());
            discarded = addSaturated(discarded, d.discardedHours());
        }
        return new Distribution(contributions, discarded);
    }

    public Distribution distribute(Span span) {
        // long math: a single overlong token can put the end past Integer.MAX_VALUE hours
        long firstHour = (long) Math.floor(span.startSec() / SECONDS_PER_HOUR);
        long lastHour = Math.max(firstHour, (long) Math.ceil(span.endSec() / SECONDS_PER_HOUR) - 1);

        long lastEmitted = Math.min(lastHour, EnergyAggregator.LAST_HOUR);
        long discarded = lastHour > EnergyAggregator.LAST_HOUR
                ? lastHour - Math.max(firstHour, EnergyAggregator.LAST_HOUR + 1L) + 1
                : 0;

        List<HourContribution> contributions = new ArrayList<>();
        for (long hour = Math.max(firstHour, EnergyAggregator.FIRST_HOUR); hour <= lastEmitted; hour++) {
            double hourStart = (double) hour * SECONDS_PER_HOUR;
            double hourEnd = hourStart + SECONDS_PER_HOUR;
            double overlap = Math.max(0.0, Math.min(span.endSec(), hourEnd) - Math.max(span.startSec(), hourStart));
            contributions.add(new HourContribution(span.deviceId(), span.date(), (int) hour, span.current(), overlap));
        }
        return new Distribution(contributions, discarded);
    }

    /** Sum of two non-negative counts, pinned at {@link Long#MAX_VALUE}. */
    public static long addSaturated(long a, long b) {
        long sum = a + b;
        return sum < 0 ? Long.MAX_VALUE : sum;
    }
}
