package com.hvacintel.consumption.telemetry;

import com.hvacintel.consumption.model.HourContribution;
import com.hvacintel.consumption.model.Measurement;
import com.hvacintel.consumption.model.TelemetryPayloadRow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs payload rows of one device version through parse → spans → hour buckets → kWh.
 *
 * Rows sharing a (device, date) are decoded in row order onto a single day clock.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class DirectConsumptionCalculator {

    private final PayloadParser parser;
    private final SpanBuilder spanBuilder;
    private final HourBucketDistributor distributor;
    private final EnergyAggregator aggregator;
    private final CalibrationFactors calibrationFactors;

    private record DeviceDay(String deviceId, LocalDate date) {}

    public EnergyAggregator.Result compute(String deviceVersion, List<TelemetryPayloadRow> rows) {
        Map<DeviceDay, List<Measurement>> measurementsByDay = new LinkedHashMap<>();
        for (TelemetryPayloadRow row : rows) {
            if (row.deviceId() == null || row.date() == null) continue;
            measurementsByDay
                    .computeIfAbsent(new DeviceDay(row.deviceId(), row.date()), k -> new ArrayList<>())
                    .addAll(parser.parse(row.payload()));
        }

        List<HourContribution> contributions = new ArrayList<>();
        long beyondDay = 0;
        for (Map.Entry<DeviceDay, List<Measurement>> entry : measurementsByDay.entrySet()) {
            DeviceDay day = entry.getKey();
            HourBucketDistributor.Distribution distribution =
                    distributor.distribute(spanBuilder.build(day.deviceId(), day.date(), entry.getValue()));
            contributions.addAll(distribution.contributions());
            beyondDay = HourBucketDistributor.addSaturated(beyondDay, distribution.discardedHours());
        }

        double factor = calibrationFactors.factorFor(deviceVersion);
        EnergyAggregator.Result aggregated = aggregator.aggregate(contributions, factor);
        EnergyAggregator.Result result = new EnergyAggregator.Result(aggregated.energies(),
                HourBucketDistributor.addSaturated(beyondDay, aggregated.discardedHourBuckets()));

        log.debug("Version {}: {} device-days decoded into {} hourly values (K={})",
                deviceVersion, measurementsByDay.size(), result.energies().size(), factor);
        if (result.discardedHourBuckets() > 0) {
            log.warn("Version {}: {} hour buckets discarded (beyond hour 23 or not finite)",
                    deviceVersion, result.discardedHourBuckets());
        }
        return result;
    }
}
