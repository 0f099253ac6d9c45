package com.hvacintel.consumption.service;

import com.hvacintel.consumption.exception.EstimationException;
import com.hvacintel.consumption.model.AttributionState;
import com.hvacintel.consumption.model.AvailabilityRecord;
import com.hvacintel.consumption.model.ConsumptionMethod;
import com.hvacintel.consumption.model.ConsumptionRecord;
import com.hvacintel.consumption.model.HourlyEnergy;
import com.hvacintel.consumption.model.IndirectConsumptionRow;
import com.hvacintel.consumption.model.TelemetryPayloadRow;
import com.hvacintel.consumption.model.UnitDeviceWindow;
import com.hvacintel.consumption.telemetry.DirectConsumptionCalculator;
import com.hvacintel.consumption.telemetry.EnergyAggregator;
import com.hvacintel.consumption.telemetry.HourBucketDistributor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Decides, per device, which method's consumption represents it and merges the result.
 *
 * 1. Direct: one telemetry query per device version over the version's combined window,
 *    decoded to hourly kWh and filtered by window and availability.
 * 2. Indirect: every roster device left without a direct record (including devices of
 *    versions that were skipped or came back empty) is queried on its own window.
 * 3. Consolidation: keyed merge of both sets.
 *
 * Work items run on the bounded estimator pool; results are collected per device in
 * concurrent maps, so completion order has no effect on the output. Any query failure
 * aborts the attribution.
 */
@Service
@Slf4j
public class AttributionPipeline {

    private final TelemetryQueryClient telemetryClient;
    private final OperationalQueryClient operationalClient;
    private final DirectConsumptionCalculator calculator;
    private final ConsumptionConsolidator consolidator;
    private final ExecutorService workerPool;

    public AttributionPipeline(TelemetryQueryClient telemetryClient,
                               OperationalQueryClient operationalClient,
                               DirectConsumptionCalculator calculator,
                               ConsumptionConsolidator consolidator,
                               @Qualifier("estimatorWorkerPool") ExecutorService workerPool) {
        this.telemetryClient = telemetryClient;
        this.operationalClient = operationalClient;
        this.calculator = calculator;
        this.consolidator = consolidator;
        this.workerPool = workerPool;
    }

    /**
     * @param windows      device windows in roster order
     * @param availability device-dates that met the availability threshold
     * @param families     device versions that carry a current parameter
     */
    public record Request(List<UnitDeviceWindow> windows,
                          Collection<AvailabilityRecord> availability,
                          Collection<String> families) {
    }

    public record Result(List<ConsumptionRecord> records,
                         Map<String, AttributionState> versionStates,
                         int directRecords,
                         int indirectRecords,
                         int devicesQueuedForIndirect,
                         long discardedHourBuckets,
                         int duplicatesResolved) {

        public boolean noDirectData() {
            return directRecords == 0;
        }
    }

    public Result attribute(Request request) {
        ValidityFilter filter = new ValidityFilter(request.windows(), request.availability());
        Map<String, List<UnitDeviceWindow>> windowsByVersion = groupByVersion(request.windows());
        List<String> versions = selectVersions(windowsByVersion, request.families());

        Map<String, AttributionState> states = new ConcurrentHashMap<>();
        versions.forEach(v -> states.put(v, AttributionState.PENDING));

        // ── Direct ───────────────────────────────────────────────────────────
        Map<String, List<ConsumptionRecord>> directByDevice = new ConcurrentHashMap<>();
        AtomicLong discardedBuckets = new AtomicLong();

        awaitAll("direct", versions, version ->
                CompletableFuture.runAsync(() -> computeDirect(version, windowsByVersion.get(version),
                        filter, states, directByDevice, discardedBuckets), workerPool));

        int directCount = countRecords(directByDevice);
        log.info("Direct method: {} records for {} devices across {} versions",
                directCount, directByDevice.size(), versions.size());

        if (directCount == 0) {
            log.error("No direct consumption found for any device version. Nothing will be consolidated.");
            return new Result(List.of(), orderedStates(versions, states), 0, 0, 0, discardedBuckets.get(), 0);
        }

        // ── Indirect ─────────────────────────────────────────────────────────
        List<UnitDeviceWindow> queue = devicesWithoutDirect(request.windows(), directByDevice.keySet());
        log.info("Indirect method: {} devices queued ({} already have direct consumption)",
                queue.size(), directByDevice.size());

        Map<String, List<ConsumptionRecord>> indirectByDevice = new ConcurrentHashMap<>();
        awaitAll("indirect", queue, window ->
                CompletableFuture.runAsync(() -> computeIndirect(window, filter, indirectByDevice), workerPool));

        Set<String> versionsWithIndirect = queue.stream().map(UnitDeviceWindow::deviceVersion).collect(Collectors.toSet());
        versionsWithIndirect.stream()
                .filter(states::containsKey)
                .forEach(v -> states.put(v, AttributionState.INDIRECT_COMPUTED));

        // ── Consolidation ────────────────────────────────────────────────────
        List<ConsumptionRecord> direct = flatten(directByDevice);
        List<ConsumptionRecord> indirect = flatten(indirectByDevice);
        ConsumptionConsolidator.Result consolidated = consolidator.consolidate(direct, indirect);
        versions.forEach(v -> states.put(v, AttributionState.CONSOLIDATED));

        log.info("Consolidated {} records ({} direct, {} indirect, {} duplicates resolved)",
                consolidated.records().size(), direct.size(), indirect.size(), consolidated.duplicatesResolved());

        return new Result(consolidated.records(), orderedStates(versions, states),
                direct.size(), indirect.size(), queue.size(),
                discardedBuckets.get(), consolidated.duplicatesResolved());
    }

    // ── Work items ───────────────────────────────────────────────────────────

    private void computeDirect(String version,
                               List<UnitDeviceWindow> versionWindows,
                               ValidityFilter filter,
                               Map<String, AttributionState> states,
                               Map<String, List<ConsumptionRecord>> directByDevice,
                               AtomicLong discardedBuckets) {
        LocalDate start = versionWindows.stream().map(UnitDeviceWindow::installDate)
                .min(Comparator.naturalOrder()).orElseThrow();
        LocalDate end = versionWindows.stream().map(UnitDeviceWindow::automationStartDate)
                .max(Comparator.naturalOrder()).orElseThrow();

        List<TelemetryPayloadRow> rows = telemetryClient.fetchPayloads(version, start, end);
        EnergyAggregator.Result energy = calculator.compute(version, rows);
        states.put(version, AttributionState.DIRECT_COMPUTED);
        discardedBuckets.accumulateAndGet(energy.discardedHourBuckets(), HourBucketDistributor::addSaturated);

        Map<String, UnitDeviceWindow> versionDevices = versionWindows.stream()
                .collect(Collectors.toMap(UnitDeviceWindow::deviceId, Function.identity(), (a, b) -> a));

        Map<String, List<ConsumptionRecord>> accepted = new LinkedHashMap<>();
        for (HourlyEnergy e : energy.energies()) {
            UnitDeviceWindow window = versionDevices.get(e.deviceId());
            if (window == null || e.consumoKwh() <= 0 || !filter.accepts(e.deviceId(), e.date())) {
                continue;
            }
            accepted.computeIfAbsent(e.deviceId(), k -> new ArrayList<>())
                    .add(toRecord(window, e.date(), e.hour(), e.consumoKwh(), ConsumptionMethod.DIRECT));
        }
        directByDevice.putAll(accepted);

        int count = accepted.values().stream().mapToInt(List::size).sum();
        states.put(version, count > 0 ? AttributionState.DIRECT_OK : AttributionState.DIRECT_EMPTY);
        log.info("Version {} [{} → {}]: {} valid direct records for {} of {} devices",
                version, start, end, count, accepted.size(), versionWindows.size());
    }

    private void computeIndirect(UnitDeviceWindow window,
                                 ValidityFilter filter,
                                 Map<String, List<ConsumptionRecord>> indirectByDevice) {
        List<IndirectConsumptionRow> rows = operationalClient.fetchIndirectConsumption(
                window.deviceId(), window.installDate(), window.automationStartDate());

        List<ConsumptionRecord> records = rows.stream()
                .filter(r -> r.recordTimestamp() != null && r.consumption() > 0)
                .map(r -> toRecord(window, r.recordTimestamp().toLocalDate(), r.recordTimestamp().getHour(),
                        r.consumption(), ConsumptionMethod.INDIRECT))
                .filter(filter::accepts)
                .toList();

        if (!records.isEmpty()) {
            indirectByDevice.put(window.deviceId(), records);
        }
        log.debug("Device {}: {} of {} indirect rows kept", window.deviceId(), records.size(), rows.size());
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private <T> void awaitAll(String phase, List<T> items, Function<T, CompletableFuture<Void>> submit) {
        List<CompletableFuture<Void>> futures = items.stream().map(submit).toList();
        for (int i = 0; i < futures.size(); i++) {
            try {
                futures.get(i).join();
            } catch (CompletionException e) {
                futures.forEach(f -> f.cancel(true));
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.error("{} phase failed on {}: {}", phase, items.get(i), cause.getMessage(), cause);
                throw new EstimationException(
                        String.format("%s consumption query failed for %s: %s", phase, items.get(i), cause.getMessage()),
                        cause);
            }
        }
    }

    private Map<String, List<UnitDeviceWindow>> groupByVersion(List<UnitDeviceWindow> windows) {
        Map<String, List<UnitDeviceWindow>> byVersion = new LinkedHashMap<>();
        for (UnitDeviceWindow window : windows) {
            byVersion.computeIfAbsent(window.deviceVersion(), k -> new ArrayList<>()).add(window);
        }
        return byVersion;
    }

    private List<String> selectVersions(Map<String, List<UnitDeviceWindow>> windowsByVersion, Collection<String> families) {
        Set<String> valid = new HashSet<>(families);
        List<String> selected = windowsByVersion.keySet().stream().filter(valid::contains).toList();
        log.info("{} versions found, {} with current data: {}", windowsByVersion.size(), selected.size(), selected);
        return selected;
    }

    private List<UnitDeviceWindow> devicesWithoutDirect(List<UnitDeviceWindow> windows, Set<String> devicesWithDirect) {
        Set<String> seen = new HashSet<>();
        return windows.stream()
                .filter(w -> !devicesWithDirect.contains(w.deviceId()))
                .filter(w -> seen.add(w.deviceId()))
                .toList();
    }

    private ConsumptionRecord toRecord(UnitDeviceWindow window, LocalDate date, int hour, double kwh, ConsumptionMethod method) {
        return ConsumptionRecord.builder()
                .unitId(window.unitId())
                .deviceId(window.deviceId())
                .deviceVersion(window.deviceVersion())
                .date(date)
                .hour(hour)
                .consumoKwh(kwh)
                .installDate(window.installDate())
                .automationStartDate(window.automationStartDate())
                .method(method)
                .build();
    }

    private int countRecords(Map<String, List<ConsumptionRecord>> byDevice) {
        return byDevice.values().stream().mapToInt(List::size).sum();
    }

    private List<ConsumptionRecord> flatten(Map<String, List<ConsumptionRecord>> byDevice) {
        return byDevice.values().stream().flatMap(List::stream).toList();
    }

    private Map<String, AttributionState> orderedStates(List<String> versions, Map<String, AttributionState> states) {
        Map<String, AttributionState> ordered = new LinkedHashMap<>();
        versions.forEach(v -> ordered.put(v, states.get(v)));
        return ordered;
    }
}
