package com.hvacintel.consumption.telemetry;

import com.hvacintel.consumption.model.DeviceHourKey;
import com.hvacintel.consumption.model.HourContribution;
import com.hvacintel.consumption.model.HourlyEnergy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Sums hour contributions into kWh per (device, date, hour):
 *
 *   consumo_kwh = round(Σ (K · current · overlap_seconds / 3600) / 1000, 6)
 *
 * where K is the calibration factor of the device family. Buckets outside hours 0-23 and
 * buckets whose sum is not a finite number are discarded and counted.
 */
@Component
@Slf4j
public class EnergyAggregator {

    public static final int FIRST_HOUR = 0;
    public static final int LAST_HOUR = 23;
    private static final int KWH_SCALE = 6;

    public record Result(List<HourlyEnergy> energies, long discardedHourBuckets) {
    }

    public Result aggregate(List<HourContribution> contributions, double calibrationFactor) {
        Map<DeviceHourKey, Double> wattHours = new TreeMap<>();
        long discarded = 0;

        for (HourContribution c : contributions) {
            if (c.hourIndex() < FIRST_HOUR || c.hourIndex() > LAST_HOUR) {
                discarded++;
                continue;
            }
            double wh = calibrationFactor * c.current() * (c.overlapSeconds() / HourBucketDistributor.SECONDS_PER_HOUR);
            wattHours.merge(new DeviceHourKey(c.deviceId(), c.date(), c.hourIndex()), wh, Double::sum);
        }

        List<HourlyEnergy> energies = new ArrayList<>(wattHours.size());
        for (Map.Entry<DeviceHourKey, Double> entry : wattHours.entrySet()) {
            DeviceHourKey key = entry.getKey();
            double kwh = entry.getValue() / 1000.0;
            if (!Double.isFinite(kwh)) {
                log.warn("Device {} {} hour {}: energy overflowed ({}), bucket discarded",
                        key.deviceId(), key.date(), key.hour(), kwh);
                discarded++;
                continue;
            }
            energies.add(new HourlyEnergy(key.deviceId(), key.date(), key.hour(), roundKwh(kwh)));
        }
        return new Result(energies, discarded);
    }

    static double roundKwh(double kwh) {
        return BigDecimal.valueOf(kwh).setScale(KWH_SCALE, RoundingMode.HALF_UP).doubleValue();
    }
}
