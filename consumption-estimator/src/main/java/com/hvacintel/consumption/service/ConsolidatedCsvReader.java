package com.hvacintel.consumption.service;

import com.hvacintel.consumption.exception.EstimationException;
import com.hvacintel.consumption.model.ConsumptionMethod;
import com.hvacintel.consumption.model.ConsumptionRecord;
import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads a consolidated consumption CSV written by a previous run, so the unit
 * aggregation can be repeated without querying the data stores again.
 */
@Component
@Slf4j
public class ConsolidatedCsvReader {

    static final List<String> REQUIRED_COLUMNS =
            List.of("unit_id", "device_id", "data", "hora", "metodo", "consumo_kwh");

    public List<ConsumptionRecord> read(Path path) {
        try (Reader in = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             CSVReader reader = new CSVReader(in)) {

            CsvHeaders headers = CsvHeaders.of(reader.readNext()).require(REQUIRED_COLUMNS, path.toString());

            List<ConsumptionRecord> records = new ArrayList<>();
            int malformed = 0;
            String[] row;
            while ((row = reader.readNext()) != null) {
                if (row.length == 1 && row[0].isBlank()) continue;
                try {
                    records.add(toRecord(headers, row));
                } catch (IllegalArgumentException | DateTimeParseException e) {
                    malformed++;
                    log.debug("Skipping line {} of {}: {}", reader.getLinesRead(), path, e.getMessage());
                }
            }

            if (malformed > 0) {
                log.warn("{}: {} malformed rows skipped", path, malformed);
            }
            log.info("Read {} consolidated records from {}", records.size(), path);
            return records;

        } catch (IOException | CsvValidationException e) {
            throw new EstimationException("Failed to read consolidated CSV " + path + ": " + e.getMessage(), e);
        }
    }

    private ConsumptionRecord toRecord(CsvHeaders headers, String[] row) {
        return ConsumptionRecord.builder()
                .unitId((long) Double.parseDouble(headers.get(row, "unit_id")))
                .deviceId(headers.get(row, "device_id"))
                .deviceVersion(optional(headers, row, "device_version"))
                .date(LocalDate.parse(headers.get(row, "data")))
                .hour((int) Double.parseDouble(headers.get(row, "hora")))
                .consumoKwh(Double.parseDouble(headers.get(row, "consumo_kwh")))
                .installDate(optionalDate(headers, row, "data_instalacao"))
                .automationStartDate(optionalDate(headers, row, "data_inicio_automacao"))
                .method(ConsumptionMethod.fromLabel(headers.get(row, "metodo")))
                .build();
    }

    private String optional(CsvHeaders headers, String[] row, String column) {
        String value = headers.get(row, column);
        return value.isEmpty() ? null : value;
    }

    private LocalDate optionalDate(CsvHeaders headers, String[] row, String column) {
        String value = optional(headers, row, column);
        return value == null ? null : LocalDate.parse(value);
    }
}
