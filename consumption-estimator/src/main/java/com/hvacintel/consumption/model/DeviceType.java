package com.hvacintel.consumption.model;

import java.util.Locale;

public enum DeviceType {
    DAC, DUT, OTHER;

    private static final int CODE_PREFIX_LENGTH = 3;

    public static DeviceType fromDeviceId(String deviceId) {
        if (deviceId == null || deviceId.length() < CODE_PREFIX_LENGTH) {
            return OTHER;
        }
        String prefix = deviceId.substring(0, CODE_PREFIX_LENGTH).toUpperCase(Locale.ROOT);
        return switch (prefix) {
            case "DAC" -> DAC;
            case "DUT" -> DUT;
            default -> OTHER;
        };
    }
}
