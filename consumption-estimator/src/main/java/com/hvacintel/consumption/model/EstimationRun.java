package com.hvacintel.consumption.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * Tracks each estimation run for observability.
 * Stored in the estimation_runs table when ClickHouse output is enabled.
 */
@Data
@Builder
public class EstimationRun {

    public enum Status {
        RUNNING, SUCCESS, NO_DIRECT_DATA, FAILED, SKIPPED
    }

    private String runId;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private Status status;

    private int unitsLoaded;
    private int devicesAssigned;
    private int versionsProcessed;
    private int directRecords;
    private int indirectRecords;
    private int devicesQueuedForIndirect;

    // data-quality counters
    private long discardedHourBuckets;
    private int duplicatesResolved;

    private String outputLocation;
    private String errorMessage;    // null on success
}
