package com.hvacintel.consumption.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class UnitSummary {

    private long unitId;
    private double consumoTotalKwh;
    private int diasComDados;
    /** Roll-up rows (unit-hours) obtained by the direct method */
    private int registrosDireto;
    private int registrosIndireto;
    private double dispositivosMedio;
}
