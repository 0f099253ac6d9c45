package com.hvacintel.consumption.scheduler;

import com.hvacintel.consumption.config.EstimatorProperties;
import com.hvacintel.consumption.output.ClickHouseWriter;
import com.hvacintel.consumption.service.ConsumptionEstimationService;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Manages scheduled and on-startup estimation runs.
 *
 * Default schedule: every day at 03:00 UTC, after the nightly telemetry cache refresh.
 * Override with the ESTIMATION_CRON env var or consumption-estimator.scheduling.cron.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class EstimationScheduler {

    private final ConsumptionEstimationService estimationService;
    private final ClickHouseWriter clickHouseWriter;
    private final EstimatorProperties properties;

    @PostConstruct
    public void onStartup() {
        if (properties.getOutput().getMode() != EstimatorProperties.Output.OutputMode.CSV) {
            try {
                clickHouseWriter.ensureSchema();
            } catch (Exception e) {
                log.warn("Could not initialise ClickHouse schema: {}", e.getMessage());
            }
        }

        if (properties.getScheduling().isRunOnStartup()) {
            log.info("RUN_ON_STARTUP=true, running estimation");
            runSafely("Startup");
        } else {
            log.info("Estimator ready. Next scheduled run: {}", properties.getScheduling().getCron());
        }
    }

    @Scheduled(cron = "${consumption-estimator.scheduling.cron:0 0 3 * * ?}", zone = "UTC")
    public void scheduledEstimation() {
        log.info("Scheduled estimation triggered");
        runSafely("Scheduled");
    }

    private void runSafely(String trigger) {
        try {
            estimationService.runEstimation();
        } catch (Exception e) {
            log.error("{} estimation failed: {}", trigger, e.getMessage(), e);
        }
    }
}
