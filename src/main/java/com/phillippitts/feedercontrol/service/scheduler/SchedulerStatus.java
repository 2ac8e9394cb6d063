package com.phillippitts.feedercontrol.service.scheduler;

import com.phillippitts.feedercontrol.domain.SchedulerSettings;

import java.util.List;

/**
 * Snapshot of the scheduler.
 *
 * @param activeJobNames registered worker names, sorted, including the settings watch
 * @param liveThreadCount registered workers whose thread is still alive
 */
public record SchedulerStatus(boolean running, SchedulerSettings currentSettings, List<String> activeJobNames,
                              int liveThreadCount) {
}
