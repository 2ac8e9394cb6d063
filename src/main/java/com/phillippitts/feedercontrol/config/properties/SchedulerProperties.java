package com.phillippitts.feedercontrol.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the periodic job scheduler.
 *
 * <p>The three sync intervals are not configured here: they come from the remote settings
 * source and can change at runtime. Only the fixed cadences and scheduler mechanics live here.
 */
@ConfigurationProperties(prefix = "scheduler")
@Validated
public class SchedulerProperties {

    /** Start the scheduler when the application is ready. */
    private boolean autoStart = true;

    /** How often the settings-watch worker re-reads the interval settings. */
    @NotNull
    private Duration watchPeriod = Duration.ofSeconds(30);

    /** Upper bound on waiting for one worker to finish when stopping. */
    @NotNull
    private Duration joinTimeout = Duration.ofSeconds(5);

    /** Interval of the feed schedule runner, seconds (0 disables). */
    @PositiveOrZero
    private int feedScheduleInterval = 1;

    /** Interval of the system status monitor, seconds (0 disables). */
    @PositiveOrZero
    private int statusMonitorInterval = 1;

    /** Interval of the alerts monitor, seconds (0 disables). */
    @PositiveOrZero
    private int alertsMonitorInterval = 1;

    /** Local JSON file holding the last settings and thresholds read from the remote store. */
    @NotBlank
    private String settingsCacheFile = "data/app_settings.json";

    @NotBlank
    private String threadNamePrefix = "scheduler-";

    public boolean isAutoStart() {
        return autoStart;
    }

    public void setAutoStart(boolean autoStart) {
        this.autoStart = autoStart;
    }

    public Duration getWatchPeriod() {
        return watchPeriod;
    }

    public void setWatchPeriod(Duration watchPeriod) {
        this.watchPeriod = watchPeriod;
    }

    public Duration getJoinTimeout() {
        return joinTimeout;
    }

    public void setJoinTimeout(Duration joinTimeout) {
        this.joinTimeout = joinTimeout;
    }

    public int getFeedScheduleInterval() {
        return feedScheduleInterval;
    }

    public void setFeedScheduleInterval(int feedScheduleInterval) {
        this.feedScheduleInterval = feedScheduleInterval;
    }

    public int getStatusMonitorInterval() {
        return statusMonitorInterval;
    }

    public void setStatusMonitorInterval(int statusMonitorInterval) {
        this.statusMonitorInterval = statusMonitorInterval;
    }

    public int getAlertsMonitorInterval() {
        return alertsMonitorInterval;
    }

    public void setAlertsMonitorInterval(int alertsMonitorInterval) {
        this.alertsMonitorInterval = alertsMonitorInterval;
    }

    public String getSettingsCacheFile() {
        return settingsCacheFile;
    }

    public void setSettingsCacheFile(String settingsCacheFile) {
        this.settingsCacheFile = settingsCacheFile;
    }

    public String getThreadNamePrefix() {
        return threadNamePrefix;
    }

    public void setThreadNamePrefix(String threadNamePrefix) {
        this.threadNamePrefix = threadNamePrefix;
    }
}
