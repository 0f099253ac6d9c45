package com.hvacintel.consumption.model;

import java.util.Arrays;

/**
 * How a consumption figure was obtained. The label is the value written to the
 * {@code metodo} output column.
 */
public enum ConsumptionMethod {
    DIRECT("direto"),
    INDIRECT("indireto");

    private final String label;

    ConsumptionMethod(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static ConsumptionMethod fromLabel(String label) {
        return Arrays.stream(values())
                .filter(m -> m.label.equalsIgnoreCase(label == null ? "" : label.trim()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown consumption method: " + label));
    }
}
