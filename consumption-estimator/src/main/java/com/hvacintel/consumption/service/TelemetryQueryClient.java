package com.hvacintel.consumption.service;

import com.hvacintel.consumption.config.EstimatorProperties;
import com.hvacintel.consumption.model.TelemetryPayloadRow;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.sql.Date;
import java.time.LocalDate;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Reads raw current payloads from the telemetry warehouse, one table per device version.
 *
 * Transient failures are retried with exponential backoff (Resilience4j instance
 * "telemetryQuery"); a failure that survives the retries propagates to the caller.
 */
@Service
@Slf4j
public class TelemetryQueryClient {

    private static final Pattern VERSION_NAME = Pattern.compile("[A-Za-z0-9_]+");

    private final JdbcTemplate jdbcTemplate;
    private final EstimatorProperties properties;

    public TelemetryQueryClient(@Qualifier("telemetryJdbcTemplate") JdbcTemplate jdbcTemplate,
                                EstimatorProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        this.properties = properties;
    }

    /**
     * Fetch every device-day payload of a version between two dates.
     *
     * @param deviceVersion version code, also the table name e.g. "DAC40324"
     * @param startDate     first day, inclusive
     * @param endDate       last day, inclusive
     * @return rows ordered by device and day (may be empty, never null)
     */
    @Retry(name = "telemetryQuery")
    public List<TelemetryPayloadRow> fetchPayloads(String deviceVersion, LocalDate startDate, LocalDate endDate) {
        String sql = buildPayloadQuery(deviceVersion);
        log.debug("Fetching payloads for version {} between {} and {}", deviceVersion, startDate, endDate);

        List<TelemetryPayloadRow> rows = jdbcTemplate.query(sql,
                (rs, rowNum) -> new TelemetryPayloadRow(
                        rs.getString("device_id"),
                        rs.getDate("day").toLocalDate(),
                        rs.getString("payload")),
                Date.valueOf(startDate), Date.valueOf(endDate));

        log.info("Version {}: {} payload rows between {} and {}", deviceVersion, rows.size(), startDate, endDate);
        return rows;
    }

    String buildPayloadQuery(String deviceVersion) {
        if (deviceVersion == null || !VERSION_NAME.matcher(deviceVersion).matches()) {
            throw new IllegalArgumentException("Invalid device version: " + deviceVersion);
        }
        EstimatorProperties.Telemetry telemetry = properties.getTelemetry();
        String table = String.format(telemetry.getTableTemplate(), deviceVersion);

        String prefixFilter = "";
        String prefix = telemetry.getDeviceIdPrefix();
        if (prefix != null && !prefix.isBlank()) {
            if (!VERSION_NAME.matcher(prefix).matches()) {
                throw new IllegalArgumentException("Invalid device id prefix: " + prefix);
            }
            prefixFilter = String.format("AND %s LIKE '%s%%'", telemetry.getDeviceColumn(), prefix);
        }

        return String.format("""
            SELECT
                %1$s AS device_id,
                %2$s AS day,
                %3$s AS payload
            FROM %4$s
            WHERE %2$s BETWEEN ? AND ?
              %5$s
            ORDER BY %1$s, %2$s
            """,
                telemetry.getDeviceColumn(),
                telemetry.getDateColumn(),
                telemetry.getPayloadExpression(),
                table,
                prefixFilter);
    }
}
