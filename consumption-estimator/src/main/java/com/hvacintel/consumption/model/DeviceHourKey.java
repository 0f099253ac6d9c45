package com.hvacintel.consumption.model;

import java.time.LocalDate;
import java.util.Comparator;

public record DeviceHourKey(String deviceId, LocalDate date, int hour) implements Comparable<DeviceHourKey> {

    private static final Comparator<DeviceHourKey> ORDER = Comparator
            .comparing(DeviceHourKey::deviceId)
            .thenComparing(DeviceHourKey::date)
            .thenComparingInt(DeviceHourKey::hour);

    public static DeviceHourKey of(ConsumptionRecord record) {
        return new DeviceHourKey(record.getDeviceId(), record.getDate(), record.getHour());
    }

    @Override
    public int compareTo(DeviceHourKey other) {
        return ORDER.compare(this, other);
    }
}
