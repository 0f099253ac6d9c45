package com.hvacintel.consumption.service;

import com.hvacintel.consumption.model.AvailabilityRecord;
import com.hvacintel.consumption.model.DeviceAssignment;
import com.hvacintel.consumption.model.IndirectConsumptionRow;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.sql.Date;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Queries the operational PostgreSQL database: which devices serve which units, daily
 * availability, device families that report current, and the pre-aggregated hourly
 * consumption used by the indirect method.
 *
 * Retried with exponential backoff (Resilience4j instance "operationalQuery").
 */
@Service
@Slf4j
public class OperationalQueryClient {

    private final JdbcTemplate jdbcTemplate;

    public OperationalQueryClient(@Qualifier("operationalJdbcTemplate") JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * One row per device seen in the units' availability history at or above the threshold.
     */
    @Retry(name = "operationalQuery")
    public List<DeviceAssignment> fetchDeviceAssignments(Collection<Long> unitIds, int threshold) {
        if (unitIds.isEmpty()) return Collections.emptyList();

        String sql = String.format("""
            WITH unique_devices AS (
                SELECT DISTINCT ON (device_code)
                    device_code,
                    unit_id
                FROM device_disponibility_hist
                WHERE unit_id IN (%s)
                  AND disponibility >= ?
            )
            SELECT device_code, unit_id FROM unique_devices
            ORDER BY unit_id, device_code
            """, placeholders(unitIds.size()));

        List<Object> args = new ArrayList<>(unitIds);
        args.add(threshold);

        List<DeviceAssignment> assignments = jdbcTemplate.query(sql,
                (rs, rowNum) -> new DeviceAssignment(rs.getString("device_code"), rs.getLong("unit_id")),
                args.toArray());

        log.info("{} devices assigned to {} units", assignments.size(), unitIds.size());
        return assignments;
    }

    /**
     * Device prefixes (version codes) that have a current parameter, i.e. can be
     * computed by the direct method.
     */
    @Retry(name = "operationalQuery")
    public List<String> fetchFamiliesWithCurrentParameter(int versionLength) {
        String sql = """
            SELECT DISTINCT LEFT(device_code, ?) AS device_prefix
            FROM device_current_consumption
            WHERE consumption_ah > 0
            """;
        return jdbcTemplate.queryForList(sql, String.class, versionLength);
    }

    @Retry(name = "operationalQuery")
    public List<AvailabilityRecord> fetchAvailability(Collection<Long> unitIds, int threshold,
                                                      LocalDate startDate, LocalDate endDate) {
        if (unitIds.isEmpty()) return Collections.emptyList();

        String sql = String.format("""
            SELECT
                device_code,
                record_date
            FROM device_disponibility_hist
            WHERE unit_id IN (%s)
              AND disponibility >= ?
              AND record_date BETWEEN ? AND ?
            """, placeholders(unitIds.size()));

        List<Object> args = new ArrayList<>(unitIds);
        args.add(threshold);
        args.add(Date.valueOf(startDate));
        args.add(Date.valueOf(endDate));

        List<AvailabilityRecord> records = jdbcTemplate.query(sql,
                (rs, rowNum) -> new AvailabilityRecord(
                        rs.getString("device_code"),
                        rs.getDate("record_date").toLocalDate()),
                args.toArray());

        log.info("{} device-dates at or above {}% availability between {} and {}",
                records.size(), threshold, startDate, endDate);
        return records;
    }

    /**
     * Hourly consumption of one device from the energy efficiency history, covering
     * every hour of the first through the last day.
     */
    @Retry(name = "operationalQuery")
    public List<IndirectConsumptionRow> fetchIndirectConsumption(String deviceCode, LocalDate startDate, LocalDate endDate) {
        String sql = """
            SELECT
                device_code,
                record_date,
                consumption
            FROM energy_efficiency_hour_hist
            WHERE device_code = ?
              AND record_date >= ?
              AND record_date < ?
              AND consumption > 0
            ORDER BY record_date
            """;

        List<IndirectConsumptionRow> rows = jdbcTemplate.query(sql,
                (rs, rowNum) -> new IndirectConsumptionRow(
                        rs.getString("device_code"),
                        rs.getTimestamp("record_date").toLocalDateTime(),
                        rs.getDouble("consumption")),
                deviceCode,
                Timestamp.valueOf(startDate.atStartOfDay()),
                Timestamp.valueOf(endDate.plusDays(1).atStartOfDay()));

        log.debug("Device {}: {} indirect rows between {} and {}", deviceCode, rows.size(), startDate, endDate);
        return rows;
    }

    private String placeholders(int count) {
        return String.join(", ", Collections.nCopies(count, "?"));
    }
}
