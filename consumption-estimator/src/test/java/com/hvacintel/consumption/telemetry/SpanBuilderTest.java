package com.hvacintel.consumption.telemetry;

import com.hvacintel.consumption.model.Measurement;
import com.hvacintel.consumption.model.Span;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SpanBuilderTest {

    private static final LocalDate DAY = LocalDate.of(2025, 1, 15);

    private final SpanBuilder spanBuilder = new SpanBuilder();

    @Test
    @DisplayName("build - spans are contiguous and keep payload order")
    void build_Contiguous() {
        List<Span> spans = spanBuilder.build("DAC40324A", DAY, List.of(
                new Measurement(5, 1),
                new Measurement(3, 2),
                new Measurement(7, 3600)));

        assertThat(spans).hasSize(3);
        assertThat(spans.get(0).startSec()).isZero();
        for (int i = 1; i < spans.size(); i++) {
            assertThat(spans.get(i).startSec()).isEqualTo(spans.get(i - 1).endSec());
            assertThat(spans.get(i).index()).isEqualTo(i);
        }
        assertThat(spans.get(2).endSec()).isEqualTo(3603.0);
    }

    @Test
    @DisplayName("build - total span length equals the sum of durations")
    void build_Conservation() {
        List<Measurement> measurements = List.of(
                new Measurement(1, 0.25), new Measurement(2, 10), new Measurement(3, 1799.75));

        List<Span> spans = spanBuilder.build("DAC40324A", DAY, measurements);

        double total = spans.stream().mapToDouble(Span::durationSeconds).sum();
        assertThat(total).isEqualTo(1810.0);
        assertThat(spans.get(spans.size() - 1).endSec()).isEqualTo(1810.0);
    }

    @Test
    @DisplayName("build - no measurements, no spans")
    void build_Empty() {
        assertThat(spanBuilder.build("DAC40324A", DAY, List.of())).isEmpty();
    }
}
