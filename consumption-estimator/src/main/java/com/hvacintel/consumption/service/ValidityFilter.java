package com.hvacintel.consumption.service;

import com.hvacintel.consumption.model.AvailabilityRecord;
import com.hvacintel.consumption.model.ConsumptionRecord;
import com.hvacintel.consumption.model.UnitDeviceWindow;

import java.time.LocalDate;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Keeps a device-date only when it lies inside the device's install → automation-start
 * window and the device met the availability threshold that day.
 *
 * The same instance filters direct and indirect records of a run.
 */
public class ValidityFilter {

    private final Map<String, UnitDeviceWindow> windowsByDevice;
    private final Set<AvailabilityRecord> availability;

    public ValidityFilter(Collection<UnitDeviceWindow> windows, Collection<AvailabilityRecord> availability) {
        Map<String, UnitDeviceWindow> byDevice = new LinkedHashMap<>();
        for (UnitDeviceWindow window : windows) {
            byDevice.putIfAbsent(window.deviceId(), window);
        }
        this.windowsByDevice = Map.copyOf(byDevice);
        this.availability = Set.copyOf(availability);
    }

    public Optional<UnitDeviceWindow> windowFor(String deviceId) {
        return Optional.ofNullable(windowsByDevice.get(deviceId));
    }

    public boolean withinWindow(String deviceId, LocalDate date) {
        UnitDeviceWindow window = windowsByDevice.get(deviceId);
        return window != null && window.contains(date);
    }

    public boolean isAvailable(String deviceId, LocalDate date) {
        return availability.contains(new AvailabilityRecord(deviceId, date));
    }

    public boolean accepts(String deviceId, LocalDate date) {
        return withinWindow(deviceId, date) && isAvailable(deviceId, date);
    }

    public boolean accepts(ConsumptionRecord record) {
        return accepts(record.getDeviceId(), record.getDate());
    }

    public List<ConsumptionRecord> apply(Collection<ConsumptionRecord> records) {
        return records.stream().filter(this::accepts).toList();
    }
}
