package com.hvacintel.consumption.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDate;

/**
 * Per-unit, per-hour roll-up with composite device weights.
 *
 * Weight of a device = 50% uniform presence (1 / devices in the hour) + 50% its share
 * of the hour's consumption. The DAC/DUT averages are 0.0 when no device of that type
 * reported in the hour.
 */
@Data
@Builder
public class UnitHourAggregate {

    private long unitId;
    private LocalDate date;
    private int hour;

    private int qtdDevicesTotal;
    private int qtdDac;
    private int qtdDut;

    private double pesoMedioDac;
    private double pesoMedioDut;

    private double consumoKwhTotal;

    /** Sorted, de-duplicated, comma-joined method labels, e.g. "direto,indireto" */
    private String metodos;
}
