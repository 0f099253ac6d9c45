package com.hvacintel.consumption.service;

import com.hvacintel.consumption.config.EstimatorProperties;
import com.hvacintel.consumption.exception.EstimationException;
import com.hvacintel.consumption.model.ClientUnit;
import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the client unit roster.
 *
 * Roster columns (names configurable under consumption-estimator.roster):
 *   id_bradesco, unit_name, data_inicio_automacao, dias_antes_automacao
 *
 * Rows with an unparsable id, date or offset are skipped and counted.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class UnitRosterLoader {

    private final EstimatorProperties properties;

    public List<ClientUnit> load() {
        return load(Paths.get(properties.getRoster().getPath()));
    }

    public List<ClientUnit> load(Path path) {
        EstimatorProperties.Roster cfg = properties.getRoster();
        DateTimeFormatter dateFormat = DateTimeFormatter.ofPattern(cfg.getDatePattern());

        try (Reader in = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             CSVReader reader = new CSVReader(in)) {

            CsvHeaders headers = CsvHeaders.of(reader.readNext())
                    .require(List.of(cfg.getUnitIdColumn(), cfg.getAutomationStartColumn(), cfg.getInstallOffsetColumn()),
                            path.toString());

            List<ClientUnit> units = new ArrayList<>();
            int skipped = 0;
            String[] row;
            while ((row = reader.readNext()) != null) {
                if (isBlank(row)) continue;
                try {
                    units.add(new ClientUnit(
                            parseId(headers.get(row, cfg.getUnitIdColumn())),
                            emptyToNull(headers.get(row, cfg.getUnitNameColumn())),
                            parseOffset(headers.get(row, cfg.getInstallOffsetColumn())),
                            LocalDate.parse(headers.get(row, cfg.getAutomationStartColumn()), dateFormat)));
                } catch (NumberFormatException | DateTimeParseException e) {
                    skipped++;
                    log.debug("Skipping roster line {}: {}", reader.getLinesRead(), e.getMessage());
                }
            }

            if (skipped > 0) {
                log.warn("Roster {}: {} rows skipped (unparsable id, date or offset)", path, skipped);
            }
            log.info("Loaded {} units from {}", units.size(), path);
            return units;

        } catch (IOException | CsvValidationException e) {
            throw new EstimationException("Failed to read unit roster " + path + ": " + e.getMessage(), e);
        }
    }

    // Ids are sometimes exported as floats, e.g. "1234.0"
    private long parseId(String value) {
        return (long) Double.parseDouble(value);
    }

    private int parseOffset(String value) {
        return (int) Double.parseDouble(value);
    }

    private boolean isBlank(String[] row) {
        for (String cell : row) {
            if (cell != null && !cell.isBlank()) return false;
        }
        return true;
    }

    private String emptyToNull(String val) {
        return (val == null || val.isBlank()) ? null : val;
    }
}
