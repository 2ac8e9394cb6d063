package com.phillippitts.feedercontrol.service.health;

import com.phillippitts.feedercontrol.domain.SchedulerSettings;
import com.phillippitts.feedercontrol.service.scheduler.JobScheduler;
import com.phillippitts.feedercontrol.service.scheduler.SchedulerStatus;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SchedulerHealthIndicatorTest {

    private final JobScheduler scheduler = mock(JobScheduler.class);
    private final SchedulerHealthIndicator indicator = new SchedulerHealthIndicator(scheduler);

    @Test
    void shouldReportUpWhenAllWorkersAlive() {
        when(scheduler.status()).thenReturn(new SchedulerStatus(true, SchedulerSettings.defaults(),
                List.of("settingsWatch", "syncSensors"), 2));

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("liveThreads", 2);
    }

    @Test
    void shouldReportDegradedWithoutSettingsWatch() {
        when(scheduler.status()).thenReturn(new SchedulerStatus(true, SchedulerSettings.defaults(),
                List.of("syncSensors"), 1));

        assertThat(indicator.health().getStatus()).isEqualTo(new Status("DEGRADED"));
    }

    @Test
    void shouldReportDownWhenStopped() {
        when(scheduler.status()).thenReturn(new SchedulerStatus(false, SchedulerSettings.defaults(), List.of(), 0));

        assertThat(indicator.health().getStatus()).isEqualTo(Status.DOWN);
    }
}
