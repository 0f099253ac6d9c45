package com.hvacintel.consumption.output;

import com.hvacintel.consumption.config.EstimatorProperties;
import com.hvacintel.consumption.exception.EstimationException;
import com.hvacintel.consumption.model.ConsumptionRecord;
import com.hvacintel.consumption.model.UnitHourAggregate;
import com.hvacintel.consumption.model.UnitMethodRollup;
import com.hvacintel.consumption.model.UnitSummary;
import com.opencsv.CSVWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.function.Function;

/**
 * Writes estimation results to CSV files under {outputDir}:
 *
 *   consumption_consolidated.csv          one row per device-hour and method
 *   consumption_aggregated_by_unit.csv    per (unit, date, hour, method)
 *   consumption_unit_hour_weights.csv     per (unit, date, hour) with DAC/DUT weights
 *   consumption_unit_summary.csv          per unit
 *
 * The consolidated file can be read back by ConsolidatedCsvReader. Files are overwritten
 * on every run.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CsvWriter {

    public static final String CONSOLIDATED_FILE = "consumption_consolidated.csv";
    public static final String ROLLUP_FILE = "consumption_aggregated_by_unit.csv";
    public static final String WEIGHTS_FILE = "consumption_unit_hour_weights.csv";
    public static final String SUMMARY_FILE = "consumption_unit_summary.csv";

    private static final String[] CONSOLIDATED_HEADERS = {
            "unit_id", "device_id", "device_version",
            "hora", "data", "consumo_kwh",
            "data_instalacao", "data_inicio_automacao", "metodo"
    };

    private static final String[] ROLLUP_HEADERS = {
            "unit_id", "data", "hora", "metodo", "consumo_kwh_total", "qtd_dispositivos"
    };

    private static final String[] WEIGHTS_HEADERS = {
            "unit_id", "data", "hora",
            "qtd_devices_total", "qtd_dac", "qtd_dut",
            "peso_medio_dac", "peso_medio_dut",
            "consumo_kwh_total", "metodos"
    };

    private static final String[] SUMMARY_HEADERS = {
            "unit_id", "consumo_total_kwh", "dias_com_dados",
            "registros_direto", "registros_indireto", "dispositivos_medio"
    };

    private final EstimatorProperties properties;

    public Path writeConsolidated(List<ConsumptionRecord> records) {
        return write(CONSOLIDATED_FILE, CONSOLIDATED_HEADERS, records, r -> new String[]{
                str(r.getUnitId()),
                str(r.getDeviceId()),
                str(r.getDeviceVersion()),
                str(r.getHour()),
                str(r.getDate()),
                num(r.getConsumoKwh()),
                str(r.getInstallDate()),
                str(r.getAutomationStartDate()),
                r.getMethod() != null ? r.getMethod().label() : ""
        });
    }

    public Path writeRollup(List<UnitMethodRollup> rollup) {
        return write(ROLLUP_FILE, ROLLUP_HEADERS, rollup, r -> new String[]{
                str(r.getUnitId()),
                str(r.getDate()),
                str(r.getHour()),
                r.getMethod() != null ? r.getMethod().label() : "",
                num(r.getConsumoKwhTotal()),
                str(r.getQtdDispositivos())
        });
    }

    public Path writeHourlyWeights(List<UnitHourAggregate> aggregates) {
        return write(WEIGHTS_FILE, WEIGHTS_HEADERS, aggregates, a -> new String[]{
                str(a.getUnitId()),
                str(a.getDate()),
                str(a.getHour()),
                str(a.getQtdDevicesTotal()),
                str(a.getQtdDac()),
                str(a.getQtdDut()),
                num(a.getPesoMedioDac()),
                num(a.getPesoMedioDut()),
                num(a.getConsumoKwhTotal()),
                str(a.getMetodos())
        });
    }

    public Path writeSummary(List<UnitSummary> summaries) {
        return write(SUMMARY_FILE, SUMMARY_HEADERS, summaries, s -> new String[]{
                str(s.getUnitId()),
                num(s.getConsumoTotalKwh()),
                str(s.getDiasComDados()),
                str(s.getRegistrosDireto()),
                str(s.getRegistrosIndireto()),
                num(s.getDispositivosMedio())
        });
    }

    public Path outputDir() {
        return Paths.get(properties.getOutput().getCsv().getOutputDir());
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private <T> Path write(String filename, String[] headers, List<T> rows, Function<T, String[]> toRow) {
        Path outputDir = outputDir();
        ensureDirectory(outputDir);
        Path outputPath = outputDir.resolve(filename);

        try (CSVWriter writer = new CSVWriter(
                Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8),
                CSVWriter.DEFAULT_SEPARATOR,
                CSVWriter.DEFAULT_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                CSVWriter.DEFAULT_LINE_END)) {

            if (properties.getOutput().getCsv().isIncludeHeader()) {
                writer.writeNext(headers);
            }

            for (T row : rows) {
                writer.writeNext(toRow.apply(row));
            }

            log.info("Written {} rows to CSV: {}", rows.size(), outputPath);
            return outputPath;

        } catch (IOException e) {
            log.error("Failed to write CSV file {}: {}", outputPath, e.getMessage(), e);
            throw new EstimationException("CSV write failed: " + outputPath, e);
        }
    }

    private String str(Object val) {
        return val == null ? "" : val.toString();
    }

    // Plain decimal notation, never scientific (9.17E-4 -> 0.000917)
    private String num(double val) {
        return BigDecimal.valueOf(val).stripTrailingZeros().toPlainString();
    }

    private void ensureDirectory(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new EstimationException("Cannot create output directory: " + dir, e);
        }
    }
}
