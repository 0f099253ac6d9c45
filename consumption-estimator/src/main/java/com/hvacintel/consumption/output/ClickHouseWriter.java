package com.hvacintel.consumption.output;

import com.hvacintel.consumption.config.EstimatorProperties;
import com.hvacintel.consumption.exception.EstimationException;
import com.hvacintel.consumption.model.ConsumptionRecord;
import com.hvacintel.consumption.model.EstimationRun;
import com.hvacintel.consumption.model.UnitHourAggregate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Writes consolidated consumption, hourly unit aggregates and run metadata to ClickHouse.
 *
 * The results data source only exists when consumption-estimator.datasource.results.url
 * is set; writing without it fails.
 */
@Component
@Slf4j
public class ClickHouseWriter {

    private static final int BATCH_SIZE = 1000;
    private static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final ObjectProvider<JdbcTemplate> jdbcTemplateProvider;
    private final EstimatorProperties properties;

    public ClickHouseWriter(@Qualifier("resultsJdbcTemplate") ObjectProvider<JdbcTemplate> jdbcTemplateProvider,
                            EstimatorProperties properties) {
        this.jdbcTemplateProvider = jdbcTemplateProvider;
        this.properties = properties;
    }

    public boolean isConfigured() {
        return jdbcTemplateProvider.getIfAvailable() != null;
    }

    public void ensureSchema() {
        JdbcTemplate jdbcTemplate = jdbcTemplate();
        String db = database();
        log.info("Ensuring ClickHouse schema exists in {}...", db);

        jdbcTemplate.execute("CREATE DATABASE IF NOT EXISTS " + db);

        jdbcTemplate.execute(String.format("""
            CREATE TABLE IF NOT EXISTS %s.consumption_consolidated
            (
                unit_id                 Int64,
                device_id               String,
                device_version          LowCardinality(String),
                hora                    UInt8,
                data                    Date,
                consumo_kwh             Float64,
                data_instalacao         Nullable(Date),
                data_inicio_automacao   Nullable(Date),
                metodo                  LowCardinality(String)
            )
            ENGINE = ReplacingMergeTree()
            PARTITION BY toYYYYMM(data)
            ORDER BY (unit_id, device_id, data, hora, metodo)
        """, db));

        jdbcTemplate.execute(String.format("""
            CREATE TABLE IF NOT EXISTS %s.consumption_unit_hour
            (
                unit_id             Int64,
                data                Date,
                hora                UInt8,
                qtd_devices_total   Int32,
                qtd_dac             Int32,
                qtd_dut             Int32,
                peso_medio_dac      Float64,
                peso_medio_dut      Float64,
                consumo_kwh_total   Float64,
                metodos             LowCardinality(String)
            )
            ENGINE = ReplacingMergeTree()
            PARTITION BY toYYYYMM(data)
            ORDER BY (unit_id, data, hora)
        """, db));

        jdbcTemplate.execute(String.format("""
            CREATE TABLE IF NOT EXISTS %s.estimation_runs
            (
                run_id                      String,
                started_at                  DateTime,
                completed_at                Nullable(DateTime),
                status                      LowCardinality(String),
                units_loaded                Int32,
                devices_assigned            Int32,
                versions_processed          Int32,
                direct_records              Int32,
                indirect_records            Int32,
                devices_queued_indirect     Int32,
                discarded_hour_buckets      Int64,
                duplicates_resolved         Int32,
                output_location             Nullable(String),
                error_message               Nullable(String)
            )
            ENGINE = MergeTree()
            ORDER BY (started_at, run_id)
        """, db));

        log.info("ClickHouse schema ready.");
    }

    public void writeConsolidated(List<ConsumptionRecord> records) {
        writeInBatches("consumption_consolidated", """
            (unit_id, device_id, device_version, hora, data, consumo_kwh,
             data_instalacao, data_inicio_automacao, metodo)
            """, records, r -> String.format("(%d,%s,%s,%d,%s,%s,%s,%s,%s)",
                r.getUnitId(),
                sqlStr(r.getDeviceId()),
                sqlStr(r.getDeviceVersion() != null ? r.getDeviceVersion() : ""),
                r.getHour(),
                sqlStr(r.getDate()),
                sqlNum(r.getConsumoKwh()),
                sqlStr(r.getInstallDate()),
                sqlStr(r.getAutomationStartDate()),
                sqlStr(r.getMethod().label())));
    }

    public void writeHourlyAggregates(List<UnitHourAggregate> aggregates) {
        writeInBatches("consumption_unit_hour", """
            (unit_id, data, hora, qtd_devices_total, qtd_dac, qtd_dut,
             peso_medio_dac, peso_medio_dut, consumo_kwh_total, metodos)
            """, aggregates, a -> String.format("(%d,%s,%d,%d,%d,%d,%s,%s,%s,%s)",
                a.getUnitId(),
                sqlStr(a.getDate()),
                a.getHour(),
                a.getQtdDevicesTotal(),
                a.getQtdDac(),
                a.getQtdDut(),
                sqlNum(a.getPesoMedioDac()),
                sqlNum(a.getPesoMedioDut()),
                sqlNum(a.getConsumoKwhTotal()),
                sqlStr(a.getMetodos())));
    }

    public void writeRun(EstimationRun run) {
        String sql = String.format("""
            INSERT INTO %s.estimation_runs
            (run_id, started_at, completed_at, status, units_loaded, devices_assigned,
             versions_processed, direct_records, indirect_records, devices_queued_indirect,
             discarded_hour_buckets, duplicates_resolved, output_location, error_message)
            VALUES (%s,%s,%s,%s,%d,%d,%d,%d,%d,%d,%d,%d,%s,%s)
            """,
                database(),
                sqlStr(run.getRunId()),
                sqlStr(run.getStartedAt() != null ? DATE_TIME.format(run.getStartedAt()) : null),
                sqlStr(run.getCompletedAt() != null ? DATE_TIME.format(run.getCompletedAt()) : null),
                sqlStr(run.getStatus()),
                run.getUnitsLoaded(),
                run.getDevicesAssigned(),
                run.getVersionsProcessed(),
                run.getDirectRecords(),
                run.getIndirectRecords(),
                run.getDevicesQueuedForIndirect(),
                run.getDiscardedHourBuckets(),
                run.getDuplicatesResolved(),
                sqlStr(run.getOutputLocation()),
                sqlStr(run.getErrorMessage()));
        jdbcTemplate().execute(sql);
    }

    public String location() {
        return "clickhouse:" + database() + ".consumption_consolidated";
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    /**
     * One INSERT ... VALUES statement per batch; the ClickHouse JDBC driver handles
     * these more reliably than PreparedStatement batches.
     */
    private <T> void writeInBatches(String table, String columns, List<T> rows, Function<T, String> toValueRow) {
        if (rows.isEmpty()) return;

        JdbcTemplate jdbcTemplate = jdbcTemplate();
        int total = rows.size();
        log.info("Writing {} rows to ClickHouse {}.{} in batches of {}", total, database(), table, BATCH_SIZE);

        for (int i = 0; i < total; i += BATCH_SIZE) {
            List<T> batch = rows.subList(i, Math.min(i + BATCH_SIZE, total));
            String values = batch.stream().map(toValueRow).collect(Collectors.joining(",\n"));
            try {
                jdbcTemplate.execute("INSERT INTO " + database() + "." + table + "\n" + columns + "VALUES\n" + values);
                log.debug("Wrote batch {}/{}", Math.min(i + BATCH_SIZE, total), total);
            } catch (Exception e) {
                log.error("Batch write to {} failed at offset {}: {}", table, i, e.getMessage(), e);
                throw e;
            }
        }

        log.info("Successfully wrote {} rows to {}", total, table);
    }

    private JdbcTemplate jdbcTemplate() {
        JdbcTemplate jdbcTemplate = jdbcTemplateProvider.getIfAvailable();
        if (jdbcTemplate == null) {
            throw new EstimationException(
                    "ClickHouse output requested but consumption-estimator.datasource.results.url is not set");
        }
        return jdbcTemplate;
    }

    private String database() {
        return properties.getOutput().getClickhouse().getDatabase();
    }

    private String sqlStr(Object val) {
        if (val == null) return "NULL";
        return "'" + val.toString().replace("\\", "\\\\").replace("'", "\\'") + "'";
    }

    private String sqlNum(double val) {
        return BigDecimal.valueOf(val).toPlainString();
    }
}
