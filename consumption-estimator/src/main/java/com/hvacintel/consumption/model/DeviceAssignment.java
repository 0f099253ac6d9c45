package com.hvacintel.consumption.model;

public record DeviceAssignment(String deviceId, long unitId) {
}
