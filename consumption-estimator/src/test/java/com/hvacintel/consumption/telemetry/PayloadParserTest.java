package com.hvacintel.consumption.telemetry;

import com.hvacintel.consumption.config.EstimatorProperties;
import com.hvacintel.consumption.model.Measurement;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PayloadParserTest {

    private PayloadParser parser;

    @BeforeEach
    void setUp() {
        parser = new PayloadParser(new EstimatorProperties());
    }

    @Test
    @DisplayName("parse - skips ignored and zero-duration tokens")
    void parse_MixedPayload() {
        List<Measurement> measurements = parser.parse("5,3*2,*9,2*0");

        assertThat(measurements).containsExactly(
                new Measurement(5.0, 1.0),
                new Measurement(3.0, 2.0));
    }

    @Test
    @DisplayName("parse - null, empty and blank payloads decode to nothing")
    void parse_Empty() {
        assertThat(parser.parse(null)).isEmpty();
        assertThat(parser.parse("")).isEmpty();
        assertThat(parser.parse("   ")).isEmpty();
        assertThat(parser.parse(",,")).isEmpty();
    }

    @Test
    @DisplayName("parse - unparsable current drops the token")
    void parse_BadCurrent() {
        List<Measurement> measurements = parser.parse("abc,NaN,Infinity,0x10,4.5*10");

        assertThat(measurements).containsExactly(new Measurement(4.5, 10.0));
    }

    @Test
    @DisplayName("parse - missing or unparsable duration defaults to one second")
    void parse_DefaultDuration() {
        List<Measurement> measurements = parser.parse(" 2 , 3* , 4*x ");

        assertThat(measurements).extracting(Measurement::durationSeconds).containsOnly(1.0);
        assertThat(measurements).extracting(Measurement::current).containsExactly(2.0, 3.0, 4.0);
    }

    @Test
    @DisplayName("parse - negative duration is dropped, fractional duration kept")
    void parse_Durations() {
        List<Measurement> measurements = parser.parse("1*-5,2*0.5");

        assertThat(measurements).containsExactly(new Measurement(2.0, 0.5));
    }

    @Test
    @DisplayName("parse - configurable ignore marker")
    void parse_CustomIgnoreMarker() {
        EstimatorProperties properties = new EstimatorProperties();
        properties.getTelemetry().setIgnoreMarker("#");
        PayloadParser custom = new PayloadParser(properties);

        assertThat(custom.parse("#7,8")).containsExactly(new Measurement(8.0, 1.0));
    }
}
