package com.hvacintel.consumption.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
@Slf4j
public class WorkerPoolConfig {

    /**
     * Bounded pool for device-version and indirect-device queries. Size it to the
     * number of concurrent queries the data stores accept.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService estimatorWorkerPool(EstimatorProperties properties) {
        int poolSize = Math.max(1, properties.getWorkers().getPoolSize());
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "estimator-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            thread.setUncaughtExceptionHandler((t, e) ->
                    log.error("Uncaught exception in worker thread {}: {}", t.getName(), e.getMessage(), e));
            return thread;
        };
        log.info("Estimator worker pool initialised with {} threads", poolSize);
        return Executors.newFixedThreadPool(poolSize, threadFactory);
    }
}
