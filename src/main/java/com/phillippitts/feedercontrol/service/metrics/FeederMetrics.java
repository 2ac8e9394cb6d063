package com.phillippitts.feedercontrol.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for the job scheduler and the device link.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Job run latency and failures per job name</li>
 *   <li>Scheduler restarts by trigger (watch, manual)</li>
 *   <li>Device reconnect attempts and awaited command outcomes</li>
 *   <li>Alert log entries by action</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available under /actuator/metrics.
 */
@Component
public class FeederMetrics {

    private static final String METRIC_PREFIX = "feeder";

    private final MeterRegistry registry;

    public FeederMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records the duration of one job iteration.
     *
     * @param jobName job name
     * @param durationNanos duration in nanoseconds
     */
    public void recordJobRun(String jobName, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".job.latency")
                .description("Time taken by one job iteration")
                .tag("job", jobName)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * @param jobName job name
     * @param reason exception simple class name
     */
    public void incrementJobFailure(String jobName, String reason) {
        Counter.builder(METRIC_PREFIX + ".job.failure")
                .description("Number of failed job iterations")
                .tag("job", jobName)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementRestart(String trigger) {
        Counter.builder(METRIC_PREFIX + ".scheduler.restart")
                .description("Number of full job restarts")
                .tag("trigger", trigger)
                .register(registry)
                .increment();
    }

    public void incrementReconnectAttempt() {
        Counter.builder(METRIC_PREFIX + ".device.reconnect")
                .description("Number of device reconnect attempts")
                .register(registry)
                .increment();
    }

    /**
     * @param outcome success, timeout or disconnected
     */
    public void incrementCommand(String outcome) {
        Counter.builder(METRIC_PREFIX + ".device.command")
                .description("Number of awaited device commands by outcome")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void incrementAlertLog(String action) {
        Counter.builder(METRIC_PREFIX + ".alert.log")
                .description("Number of alert log entries by action")
                .tag("action", action)
                .register(registry)
                .increment();
    }
}
