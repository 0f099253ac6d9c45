package com.hvacintel.consumption.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDate;

@Data
@Builder
public class UnitMethodRollup {

    private long unitId;
    private LocalDate date;
    private int hour;
    private ConsumptionMethod method;
    private double consumoKwhTotal;
    private int qtdDispositivos;
}
