package com.hvacintel.consumption.output;

import com.hvacintel.consumption.config.EstimatorProperties;
import com.hvacintel.consumption.model.ConsumptionRecord;
import com.hvacintel.consumption.model.EstimationRun;
import com.hvacintel.consumption.model.UnitHourAggregate;
import com.hvacintel.consumption.model.UnitMethodRollup;
import com.hvacintel.consumption.model.UnitSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Routes output to the appropriate sink(s) based on configuration.
 * Supports CLICKHOUSE, CSV, or BOTH modes.
 *
 * The rollup and summary views are small and only go to CSV.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class OutputRouter {

    private final ClickHouseWriter clickHouseWriter;
    private final CsvWriter csvWriter;
    private final EstimatorProperties properties;

    /**
     * @return where the consolidated dataset was written, "; "-separated when both sinks are used
     */
    public String writeConsolidated(List<ConsumptionRecord> records) {
        List<String> locations = new ArrayList<>();
        if (toClickHouse()) {
            clickHouseWriter.writeConsolidated(records);
            locations.add(clickHouseWriter.location());
        }
        if (toCsv()) {
            locations.add(csvWriter.writeConsolidated(records).toString());
        }
        return String.join("; ", locations);
    }

    public void writeAggregates(List<UnitHourAggregate> hourly,
                                List<UnitMethodRollup> rollup,
                                List<UnitSummary> summaries) {
        if (toClickHouse()) {
            clickHouseWriter.writeHourlyAggregates(hourly);
        }
        if (toCsv()) {
            csvWriter.writeHourlyWeights(hourly);
            csvWriter.writeRollup(rollup);
            csvWriter.writeSummary(summaries);
        }
    }

    public void writeRun(EstimationRun run) {
        try {
            if (toClickHouse()) {
                clickHouseWriter.writeRun(run);
            }
        } catch (Exception e) {
            log.warn("Failed to write estimation run metadata: {}", e.getMessage());
        }
    }

    private boolean toClickHouse() {
        return properties.getOutput().getMode() != EstimatorProperties.Output.OutputMode.CSV;
    }

    private boolean toCsv() {
        return properties.getOutput().getMode() != EstimatorProperties.Output.OutputMode.CLICKHOUSE;
    }
}
