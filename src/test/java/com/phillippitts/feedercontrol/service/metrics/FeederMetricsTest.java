package com.phillippitts.feedercontrol.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class FeederMetricsTest {

    private MeterRegistry registry;
    private FeederMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new FeederMetrics(registry);
    }

    @Test
    void shouldRecordJobLatencyPerJob() {
        metrics.recordJobRun("syncSensors", TimeUnit.MILLISECONDS.toNanos(100));
        metrics.recordJobRun("syncSensors", TimeUnit.MILLISECONDS.toNanos(50));

        Timer timer = registry.find("feeder.job.latency")
                .tag("job", "syncSensors")
                .timer();

        assertThat(timer).isNotNull();
        assertThat(timer.count()).isEqualTo(2);
        assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(150);
    }

    @Test
    void shouldIncrementJobFailureWithReason() {
        metrics.incrementJobFailure("alertsMonitor", "ConfigUnavailableException");

        Counter counter = registry.find("feeder.job.failure")
                .tag("job", "alertsMonitor")
                .tag("reason", "ConfigUnavailableException")
                .counter();

        assertThat(counter).isNotNull();
        assertThat(counter.count()).isEqualTo(1.0);
    }

    @Test
    void shouldCountRestartsByTrigger() {
        metrics.incrementRestart("watch");
        metrics.incrementRestart("watch");
        metrics.incrementRestart("manual");

        assertThat(registry.find("feeder.scheduler.restart").tag("trigger", "watch").counter().count()).isEqualTo(2.0);
        assertThat(registry.find("feeder.scheduler.restart").tag("trigger", "manual").counter().count()).isEqualTo(1.0);
    }

    @Test
    void shouldCountDeviceActivity() {
        metrics.incrementReconnectAttempt();
        metrics.incrementCommand("timeout");
        metrics.incrementAlertLog("escalate");

        assertThat(registry.find("feeder.device.reconnect").counter().count()).isEqualTo(1.0);
        assertThat(registry.find("feeder.device.command").tag("outcome", "timeout").counter().count()).isEqualTo(1.0);
        assertThat(registry.find("feeder.alert.log").tag("action", "escalate").counter().count()).isEqualTo(1.0);
    }
}
