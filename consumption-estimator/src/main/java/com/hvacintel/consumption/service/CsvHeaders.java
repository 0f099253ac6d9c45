package com.hvacintel.consumption.service;

import com.hvacintel.consumption.exception.EstimationException;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Column lookup for header-first CSV files.
 */
final class CsvHeaders {

    private static final String BOM = "\uFEFF";

    private final Map<String, Integer> index;

    private CsvHeaders(Map<String, Integer> index) {
        this.index = index;
    }

    static CsvHeaders of(String[] header) {
        Map<String, Integer> index = new HashMap<>();
        if (header != null) {
            for (int i = 0; i < header.length; i++) {
                String name = header[i] == null ? "" : header[i].trim();
                if (i == 0 && name.startsWith(BOM)) name = name.substring(1);
                index.putIfAbsent(name, i);
            }
        }
        return new CsvHeaders(index);
    }

    /**
     * @throws EstimationException naming every required column the header lacks
     */
    CsvHeaders require(Collection<String> columns, String source) {
        List<String> missing = columns.stream().filter(c -> !index.containsKey(c)).toList();
        if (!missing.isEmpty()) {
            throw new EstimationException("Missing required columns in " + source + ": " + missing);
        }
        return this;
    }

    boolean has(String column) {
        return index.containsKey(column);
    }

    /** Trimmed value of the column, or "" when the column or the cell is absent. */
    String get(String[] row, String column) {
        Integer i = index.get(column);
        if (i == null || i >= row.length || row[i] == null) return "";
        return row[i].trim();
    }
}
