package com.phillippitts.feedercontrol.service.health;

import com.phillippitts.feedercontrol.service.scheduler.JobScheduler;
import com.phillippitts.feedercontrol.service.scheduler.SchedulerStatus;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the job scheduler: UP while running, DEGRADED while the settings watch is
 * not alive (hot reload is paused until it is replaced), DOWN when stopped.
 */
@Component("scheduler")
public class SchedulerHealthIndicator implements HealthIndicator {

    private final JobScheduler scheduler;

    public SchedulerHealthIndicator(JobScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public Health health() {
        SchedulerStatus status = scheduler.status();
        Health.Builder builder;
        if (!status.running()) {
            builder = Health.down().withDetail("status", "Scheduler stopped");
        } else if (!status.activeJobNames().contains(JobScheduler.SETTINGS_WATCH)) {
            builder = Health.status("DEGRADED").withDetail("status", "Settings watch is not running");
        } else {
            builder = Health.up().withDetail("status", "All workers running");
        }
        return builder
                .withDetail("jobs", status.activeJobNames())
                .withDetail("liveThreads", status.liveThreadCount())
                .withDetail("settings", status.currentSettings().toMap())
                .build();
    }
}
