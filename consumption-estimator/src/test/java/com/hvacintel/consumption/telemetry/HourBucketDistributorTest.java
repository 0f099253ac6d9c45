package com.hvacintel.consumption.telemetry;

import com.hvacintel.consumption.model.HourContribution;
import com.hvacintel.consumption.model.Span;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class HourBucketDistributorTest {

    private static final LocalDate DAY = LocalDate.of(2025, 1, 15);

    private final HourBucketDistributor distributor = new HourBucketDistributor();

    private Span span(double start, double end) {
        return new Span("DAC40324A", DAY, 0, 2.0, start, end);
    }

    @Test
    @DisplayName("distribute - span inside one hour yields a single bucket")
    void distribute_SingleHour() {
        List<HourContribution> contributions = distributor.distribute(span(0, 3)).contributions();

        assertThat(contributions).containsExactly(new HourContribution("DAC40324A", DAY, 0, 2.0, 3.0));
    }

    @Test
    @DisplayName("distribute - span ending exactly on the hour does not touch the next hour")
    void distribute_EndsOnBoundary() {
        List<HourContribution> contributions = distributor.distribute(span(3000, 3600)).contributions();

        assertThat(contributions).extracting(HourContribution::hourIndex).containsExactly(0);
        assertThat(contributions.get(0).overlapSeconds()).isEqualTo(600.0);
    }

    @Test
    @DisplayName("distribute - span crossing hours is split by overlap")
    void distribute_CrossesHours() {
        List<HourContribution> contributions = distributor.distribute(span(3000, 7300)).contributions();

        assertThat(contributions).extracting(HourContribution::hourIndex).containsExactly(0, 1, 2);
        assertThat(contributions).extracting(HourContribution::overlapSeconds).containsExactly(600.0, 3600.0, 100.0);
    }

    @Test
    @DisplayName("distribute - overlaps always add up to the span duration")
    void distribute_Conservation() {
        List<Span> spans = List.of(span(0, 0.5), span(3599.5, 3600.25), span(5000, 12345.75), span(80000, 86400));

        for (Span s : spans) {
            double total = distributor.distribute(s).contributions().stream().mapToDouble(HourContribution::overlapSeconds).sum();
            assertThat(total).as("span %s", s).isCloseTo(s.durationSeconds(), within(1e-9));
        }
    }

    @Test
    @DisplayName("distribute - hours past the end of the day are counted, not emitted")
    void distribute_PastMidnight() {
        HourBucketDistributor.Distribution distribution = distributor.distribute(span(86000, 90000));

        assertThat(distribution.contributions()).extracting(HourContribution::hourIndex).containsExactly(23);
        assertThat(distribution.contributions().get(0).overlapSeconds()).isEqualTo(400.0);
        assertThat(distribution.discardedHours()).isEqualTo(1);
    }

    @Test
    @DisplayName("distribute - span starting after the day emits nothing")
    void distribute_StartsAfterDay() {
        HourBucketDistributor.Distribution distribution = distributor.distribute(span(90000, 97200));

        assertThat(distribution.contributions()).isEmpty();
        assertThat(distribution.discardedHours()).isEqualTo(2);
    }

    @Test
    @DisplayName("distribute - huge duration fills the day and counts the rest without iterating it")
    void distribute_HugeDuration() {
        HourBucketDistributor.Distribution distribution = distributor.distribute(span(1, 1 + 1e20));

        assertThat(distribution.contributions()).hasSize(24);
        assertThat(distribution.contributions()).extracting(HourContribution::hourIndex).startsWith(0).endsWith(23);
        assertThat(distribution.contributions().get(23).overlapSeconds()).isEqualTo(3600.0);
        assertThat(distribution.discardedHours()).isGreaterThan(Integer.MAX_VALUE);
    }

    @Test
    @DisplayName("distribute - discarded count saturates instead of wrapping")
    void distribute_DiscardedSaturates() {
        HourBucketDistributor.Distribution distribution = distributor.distribute(
                List.of(span(0, 1e300), span(0, 1e300)));

        assertThat(distribution.contributions()).hasSize(48);
        assertThat(distribution.discardedHours()).isEqualTo(Long.MAX_VALUE);
    }
}
