package io.keepwarm.trigger;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.keepwarm.SchedulerEngine;
import io.keepwarm.models.TickSummary;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Calls {@link SchedulerEngine#tick()} on a fixed delay. Holds no scheduling logic of its own.
 */
@Slf4j
public class TickScheduler {

    private final SchedulerEngine engine;
    private final long intervalSeconds;
    private final ScheduledExecutorService scheduler;
    private volatile boolean isRunning = false;

    public TickScheduler(SchedulerEngine engine, long intervalSeconds) {
        this.engine = engine;
        this.intervalSeconds = intervalSeconds;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(
            new ThreadFactoryBuilder().setNameFormat("keepwarm-tick-%d").setDaemon(true).build());
    }

    public void start() {
        log.info("Starting tick scheduler with interval {}s", intervalSeconds);
        isRunning = true;
        scheduler.scheduleWithFixedDelay(
                this::runTick,
                0,
                intervalSeconds,
                TimeUnit.SECONDS
        );
    }

    public void stop() {
        log.info("Stopping tick scheduler");
        isRunning = false;
        scheduler.shutdown();
    }

    public boolean isRunning() {
        return isRunning;
    }

    void runTick() {
        try {
            TickSummary summary = engine.tick();
            log.debug("Scheduled tick finished: {} due, {} failed", summary.getDue(), summary.getFailed());
        } catch (Exception e) {
            // an escaping exception would cancel the fixed-delay schedule
            log.error("Error in scheduled tick: {}", e.getMessage(), e);
        }
    }
}
