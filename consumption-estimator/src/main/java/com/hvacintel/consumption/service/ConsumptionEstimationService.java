package com.hvacintel.consumption.service;

import com.hvacintel.consumption.config.EstimatorProperties;
import com.hvacintel.consumption.exception.EstimationException;
import com.hvacintel.consumption.model.AvailabilityRecord;
import com.hvacintel.consumption.model.ClientUnit;
import com.hvacintel.consumption.model.ConsumptionRecord;
import com.hvacintel.consumption.model.DeviceAssignment;
import com.hvacintel.consumption.model.EstimationRun;
import com.hvacintel.consumption.model.UnitDeviceWindow;
import com.hvacintel.consumption.model.UnitHourAggregate;
import com.hvacintel.consumption.model.UnitMethodRollup;
import com.hvacintel.consumption.model.UnitSummary;
import com.hvacintel.consumption.output.OutputRouter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Orchestrates one estimation run:
 *
 *   [1] load the unit roster
 *   [2] fetch the devices serving those units
 *   [3] fetch availability over the global install → automation window
 *   [4] fetch the device families that report current
 *   [5-7] direct estimation, indirect fallback, consolidation
 *
 * followed by writing the consolidated dataset and the unit-level aggregates.
 * Only one run executes at a time; concurrent triggers are answered with a SKIPPED run.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ConsumptionEstimationService {

    private final UnitRosterLoader rosterLoader;
    private final OperationalQueryClient operationalClient;
    private final AttributionPipeline attributionPipeline;
    private final UnitAvailabilityAggregator aggregator;
    private final ConsolidatedCsvReader consolidatedCsvReader;
    private final OutputRouter outputRouter;
    private final EstimatorProperties properties;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile EstimationRun lastRun;

    public EstimationRun runEstimation() {
        EstimationRun run = EstimationRun.builder()
                .runId(UUID.randomUUID().toString())
                .startedAt(LocalDateTime.now())
                .status(EstimationRun.Status.RUNNING)
                .build();

        if (!running.compareAndSet(false, true)) {
            log.warn("Estimation already in progress, trigger skipped");
            run.setStatus(EstimationRun.Status.SKIPPED);
            run.setCompletedAt(LocalDateTime.now());
            return run;
        }

        lastRun = run;
        log.info("Estimation run {} started", run.getRunId());
        try {
            execute(run);
            return run;
        } catch (Exception e) {
            log.error("Estimation run {} failed: {}", run.getRunId(), e.getMessage(), e);
            run.setStatus(EstimationRun.Status.FAILED);
            run.setErrorMessage(e.getMessage());
            throw e instanceof EstimationException ee ? ee : new EstimationException("Estimation run failed: " + e.getMessage(), e);
        } finally {
            run.setCompletedAt(LocalDateTime.now());
            outputRouter.writeRun(run);
            running.set(false);
            log.info("Estimation run {} finished with status {}", run.getRunId(), run.getStatus());
        }
    }

    /**
     * Repeats the unit aggregation over a consolidated CSV from an earlier run.
     */
    public List<UnitSummary> aggregateFromCsv(Path consolidatedCsv) {
        List<ConsumptionRecord> records = consolidatedCsvReader.read(consolidatedCsv);
        return aggregateAndWrite(records);
    }

    public Optional<EstimationRun> getLastRun() {
        return Optional.ofNullable(lastRun);
    }

    public boolean isRunning() {
        return running.get();
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private void execute(EstimationRun run) {
        int threshold = properties.getAvailability().getThreshold();

        // [1]
        List<ClientUnit> units = rosterLoader.load();
        run.setUnitsLoaded(units.size());
        if (units.isEmpty()) {
            throw new EstimationException("Unit roster is empty: " + properties.getRoster().getPath());
        }
        List<Long> unitIds = units.stream().map(ClientUnit::unitId).distinct().toList();

        // [2]
        List<DeviceAssignment> assignments = operationalClient.fetchDeviceAssignments(unitIds, threshold);
        List<UnitDeviceWindow> windows = buildWindows(units, assignments);
        run.setDevicesAssigned(windows.size());
        if (windows.isEmpty()) {
            log.error("No devices found for {} units", units.size());
            run.setStatus(EstimationRun.Status.NO_DIRECT_DATA);
            return;
        }

        // [3]
        LocalDate globalStart = units.stream().map(ClientUnit::installDate).min(Comparator.naturalOrder()).orElseThrow();
        LocalDate globalEnd = units.stream().map(ClientUnit::automationStartDate).max(Comparator.naturalOrder()).orElseThrow();
        log.info("Global window: {} → {}", globalStart, globalEnd);
        List<AvailabilityRecord> availability = operationalClient.fetchAvailability(unitIds, threshold, globalStart, globalEnd);

        // [4]
        List<String> families = operationalClient.fetchFamiliesWithCurrentParameter(
                properties.getTelemetry().getVersionLength());

        // [5-7]
        AttributionPipeline.Result result = attributionPipeline.attribute(
                new AttributionPipeline.Request(windows, availability, families));

        run.setVersionsProcessed(result.versionStates().size());
        run.setDirectRecords(result.directRecords());
        run.setIndirectRecords(result.indirectRecords());
        run.setDevicesQueuedForIndirect(result.devicesQueuedForIndirect());
        run.setDiscardedHourBuckets(result.discardedHourBuckets());
        run.setDuplicatesResolved(result.duplicatesResolved());

        if (result.noDirectData()) {
            run.setStatus(EstimationRun.Status.NO_DIRECT_DATA);
            return;
        }

        run.setOutputLocation(outputRouter.writeConsolidated(result.records()));
        aggregateAndWrite(result.records());
        run.setStatus(EstimationRun.Status.SUCCESS);
    }

    /**
     * Roster × assignments, in roster order. A device's version is the first
     * {@code versionLength} characters of its id.
     */
    List<UnitDeviceWindow> buildWindows(List<ClientUnit> units, List<DeviceAssignment> assignments) {
        Map<Long, List<DeviceAssignment>> byUnit = new LinkedHashMap<>();
        for (DeviceAssignment a : assignments) {
            byUnit.computeIfAbsent(a.unitId(), k -> new ArrayList<>()).add(a);
        }

        int versionLength = properties.getTelemetry().getVersionLength();
        List<UnitDeviceWindow> windows = new ArrayList<>();
        for (ClientUnit unit : units) {
            for (DeviceAssignment a : byUnit.getOrDefault(unit.unitId(), List.of())) {
                String deviceId = a.deviceId();
                String version = deviceId.length() > versionLength ? deviceId.substring(0, versionLength) : deviceId;
                windows.add(new UnitDeviceWindow(unit.unitId(), deviceId, version,
                        unit.installDate(), unit.automationStartDate()));
            }
        }
        log.info("{} device windows across {} units", windows.size(), units.size());
        return windows;
    }

    private List<UnitSummary> aggregateAndWrite(List<ConsumptionRecord> records) {
        List<UnitHourAggregate> hourly = aggregator.aggregateHourly(records);
        List<UnitMethodRollup> rollup = aggregator.rollup(records);
        List<UnitSummary> summaries = aggregator.summarize(rollup);
        outputRouter.writeAggregates(hourly, rollup, summaries);
        log.info("Unit aggregation: {} units, {} unit-hours", summaries.size(), hourly.size());
        return summaries;
    }
}
