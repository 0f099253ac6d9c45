package com.hvacintel.consumption.service;

import com.hvacintel.consumption.config.EstimatorProperties;
import com.hvacintel.consumption.config.EstimatorProperties.Attribution.ConsolidationPolicy;
import com.hvacintel.consumption.model.ConsumptionRecord;
import com.hvacintel.consumption.model.DeviceHourKey;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Merges direct and indirect records into the consolidated dataset.
 *
 * With PREFER_DIRECT an indirect record is dropped when a direct record exists for the
 * same (device, date, hour); KEEP_BOTH keeps both.
 */
@Component
@Slf4j
public class ConsumptionConsolidator {

    public static final Comparator<ConsumptionRecord> OUTPUT_ORDER = Comparator
            .comparingLong(ConsumptionRecord::getUnitId)
            .thenComparing(ConsumptionRecord::getDate)
            .thenComparingInt(ConsumptionRecord::getHour)
            .thenComparing(r -> r.getMethod().label())
            .thenComparing(ConsumptionRecord::getDeviceId);

    private final ConsolidationPolicy policy;

    public ConsumptionConsolidator(EstimatorProperties properties) {
        this.policy = properties.getAttribution().getConsolidationPolicy();
    }

    public record Result(List<ConsumptionRecord> records, int duplicatesResolved) {
    }

    public Result consolidate(Collection<ConsumptionRecord> direct, Collection<ConsumptionRecord> indirect) {
        List<ConsumptionRecord> merged = new ArrayList<>(direct.size() + indirect.size());
        merged.addAll(direct);

        Set<DeviceHourKey> directKeys = new HashSet<>();
        direct.forEach(r -> directKeys.add(DeviceHourKey.of(r)));

        int overlapping = 0;
        for (ConsumptionRecord record : indirect) {
            boolean overlaps = directKeys.contains(DeviceHourKey.of(record));
            if (overlaps) overlapping++;
            if (!overlaps || policy == ConsolidationPolicy.KEEP_BOTH) {
                merged.add(record);
            }
        }

        if (overlapping > 0) {
            log.warn("{} device-hours have both direct and indirect consumption ({})",
                    overlapping, policy == ConsolidationPolicy.KEEP_BOTH ? "both kept" : "direct kept");
        }

        merged.sort(OUTPUT_ORDER);
        int resolved = policy == ConsolidationPolicy.KEEP_BOTH ? 0 : overlapping;
        return new Result(merged, resolved);
    }
}
