package com.hvacintel.consumption.config;

import com.hvacintel.consumption.exception.EstimationException;
import com.hvacintel.consumption.model.EstimationRun;
import com.hvacintel.consumption.model.UnitSummary;
import com.hvacintel.consumption.service.ConsumptionEstimationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@Slf4j
@RequiredArgsConstructor
public class EstimationController {

    private final ConsumptionEstimationService estimationService;

    @PostMapping("/estimation/trigger")
    public ResponseEntity<Map<String, String>> trigger() {
        if (estimationService.isRunning()) {
            return ResponseEntity.status(409).body(Map.of("status", "already-running"));
        }
        new Thread(() -> {
            try {
                estimationService.runEstimation();
            } catch (Exception e) {
                log.error("Manual estimation failed: {}", e.getMessage(), e);
            }
        }, "manual-estimation").start();
        return ResponseEntity.accepted().body(Map.of("status", "accepted"));
    }

    /**
     * Re-runs the unit aggregation over an existing consolidated CSV.
     *
     * POST /estimation/aggregate?path=/data/output/consumption_consolidated.csv
     */
    @PostMapping("/estimation/aggregate")
    public ResponseEntity<?> aggregate(@RequestParam String path) {
        Path csv = Paths.get(path);
        if (!Files.isRegularFile(csv)) {
            return ResponseEntity.badRequest().body(Map.of("error", "File not found: " + path));
        }
        try {
            List<UnitSummary> summaries = estimationService.aggregateFromCsv(csv);
            return ResponseEntity.ok(summaries);
        } catch (EstimationException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Aggregation of {} failed: {}", path, e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping("/estimation/status")
    public ResponseEntity<Map<String, Object>> status() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("service", "hvac-consumption-estimator");
        body.put("version", "1.0.0");
        body.put("running", estimationService.isRunning());
        estimationService.getLastRun().ifPresent(run -> body.put("lastRun", describe(run)));
        return ResponseEntity.ok(body);
    }

    private Map<String, Object> describe(EstimationRun run) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("runId", run.getRunId());
        view.put("status", run.getStatus());
        view.put("startedAt", run.getStartedAt());
        view.put("completedAt", run.getCompletedAt());
        view.put("directRecords", run.getDirectRecords());
        view.put("indirectRecords", run.getIndirectRecords());
        view.put("devicesQueuedForIndirect", run.getDevicesQueuedForIndirect());
        view.put("discardedHourBuckets", run.getDiscardedHourBuckets());
        view.put("duplicatesResolved", run.getDuplicatesResolved());
        view.put("outputLocation", run.getOutputLocation());
        view.put("errorMessage", run.getErrorMessage());
        return view;
    }
}
