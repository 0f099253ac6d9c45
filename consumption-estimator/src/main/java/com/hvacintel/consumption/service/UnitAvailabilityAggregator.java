package com.hvacintel.consumption.service;

import com.hvacintel.consumption.model.ConsumptionMethod;
import com.hvacintel.consumption.model.ConsumptionRecord;
import com.hvacintel.consumption.model.DeviceType;
import com.hvacintel.consumption.model.UnitHourAggregate;
import com.hvacintel.consumption.model.UnitMethodRollup;
import com.hvacintel.consumption.model.UnitSummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Rolls consolidated device records up to the unit level.
 *
 * Three views are produced:
 *   - hourly aggregate with composite device weights (DAC/DUT averages)
 *   - simple rollup per (unit, date, hour, method)
 *   - one summary row per unit
 */
@Component
@Slf4j
public class UnitAvailabilityAggregator {

    private static final double PRESENCE_SHARE = 0.5;
    private static final double CONSUMPTION_SHARE = 0.5;

    private record UnitHour(long unitId, LocalDate date, int hour) implements Comparable<UnitHour> {

        private static final Comparator<UnitHour> ORDER = Comparator.comparingLong(UnitHour::unitId)
                .thenComparing(UnitHour::date)
                .thenComparingInt(UnitHour::hour);

        @Override
        public int compareTo(UnitHour o) {
            return ORDER.compare(this, o);
        }
    }

    private record UnitHourMethod(UnitHour unitHour, ConsumptionMethod method) implements Comparable<UnitHourMethod> {

        @Override
        public int compareTo(UnitHourMethod o) {
            int c = unitHour.compareTo(o.unitHour);
            return c != 0 ? c : method.label().compareTo(o.method.label());
        }
    }

    // ── Hourly weights ───────────────────────────────────────────────────────

    public List<UnitHourAggregate> aggregateHourly(Collection<ConsumptionRecord> records) {
        Map<UnitHour, List<ConsumptionRecord>> cohorts = records.stream()
                .collect(Collectors.groupingBy(this::unitHour, TreeMap::new, Collectors.toList()));

        List<UnitHourAggregate> aggregates = new ArrayList<>(cohorts.size());
        cohorts.forEach((key, cohort) -> aggregates.add(aggregateCohort(key, cohort)));

        log.info("Aggregated {} records into {} unit-hours", records.size(), aggregates.size());
        return aggregates;
    }

    private UnitHourAggregate aggregateCohort(UnitHour key, List<ConsumptionRecord> cohort) {
        Map<String, Double> consumptionByDevice = new LinkedHashMap<>();
        for (ConsumptionRecord r : cohort) {
            consumptionByDevice.merge(r.getDeviceId(), r.getConsumoKwh(), Double::sum);
        }

        int devices = consumptionByDevice.size();
        double total = consumptionByDevice.values().stream().mapToDouble(Double::doubleValue).sum();

        List<Double> dacWeights = new ArrayList<>();
        List<Double> dutWeights = new ArrayList<>();
        consumptionByDevice.forEach((deviceId, consumption) -> {
            double share = total > 0 ? consumption / total : 0.0;
            double peso = PRESENCE_SHARE * (1.0 / devices) + CONSUMPTION_SHARE * share;
            switch (DeviceType.fromDeviceId(deviceId)) {
                case DAC -> dacWeights.add(peso);
                case DUT -> dutWeights.add(peso);
                default -> { }
            }
        });

        String metodos = cohort.stream()
                .map(r -> r.getMethod().label())
                .collect(Collectors.toCollection(TreeSet::new))
                .stream()
                .collect(Collectors.joining(","));

        return UnitHourAggregate.builder()
                .unitId(key.unitId())
                .date(key.date())
                .hour(key.hour())
                .qtdDevicesTotal(devices)
                .qtdDac(dacWeights.size())
                .qtdDut(dutWeights.size())
                .pesoMedioDac(mean(dacWeights))
                .pesoMedioDut(mean(dutWeights))
                .consumoKwhTotal(round(total, 6))
                .metodos(metodos)
                .build();
    }

    // ── Rollup and summary ───────────────────────────────────────────────────

    public List<UnitMethodRollup> rollup(Collection<ConsumptionRecord> records) {
        Map<UnitHourMethod, List<ConsumptionRecord>> groups = records.stream()
                .collect(Collectors.groupingBy(
                        r -> new UnitHourMethod(unitHour(r), r.getMethod()), TreeMap::new, Collectors.toList()));

        List<UnitMethodRollup> rollup = new ArrayList<>(groups.size());
        groups.forEach((key, group) -> {
            Set<String> devices = new HashSet<>();
            double total = 0.0;
            for (ConsumptionRecord r : group) {
                devices.add(r.getDeviceId());
                total += r.getConsumoKwh();
            }
            rollup.add(UnitMethodRollup.builder()
                    .unitId(key.unitHour().unitId())
                    .date(key.unitHour().date())
                    .hour(key.unitHour().hour())
                    .method(key.method())
                    .consumoKwhTotal(round(total, 4))
                    .qtdDispositivos(devices.size())
                    .build());
        });

        log.info("Rolled up {} records into {} unit-hour-method rows", records.size(), rollup.size());
        return rollup;
    }

    public List<UnitSummary> summarize(Collection<UnitMethodRollup> rollup) {
        Map<Long, List<UnitMethodRollup>> byUnit = rollup.stream()
                .collect(Collectors.groupingBy(UnitMethodRollup::getUnitId, TreeMap::new, Collectors.toList()));

        List<UnitSummary> summaries = new ArrayList<>(byUnit.size());
        byUnit.forEach((unitId, rows) -> summaries.add(UnitSummary.builder()
                .unitId(unitId)
                .consumoTotalKwh(round(rows.stream().mapToDouble(UnitMethodRollup::getConsumoKwhTotal).sum(), 4))
                .diasComDados((int) rows.stream().map(UnitMethodRollup::getDate).distinct().count())
                .registrosDireto((int) rows.stream().filter(r -> r.getMethod() == ConsumptionMethod.DIRECT).count())
                .registrosIndireto((int) rows.stream().filter(r -> r.getMethod() == ConsumptionMethod.INDIRECT).count())
                .dispositivosMedio(round(rows.stream().mapToInt(UnitMethodRollup::getQtdDispositivos).average().orElse(0.0), 2))
                .build()));
        return summaries;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private UnitHour unitHour(ConsumptionRecord r) {
        return new UnitHour(r.getUnitId(), r.getDate(), r.getHour());
    }

    private double mean(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }

    static double round(double value, int scale) {
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }
}
