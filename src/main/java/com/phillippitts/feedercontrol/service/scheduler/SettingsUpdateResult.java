package com.phillippitts.feedercontrol.service.scheduler;

import com.phillippitts.feedercontrol.domain.SchedulerSettings;

/**
 * @param remoteSynced whether the remote store accepted the new settings
 */
public record SettingsUpdateResult(SchedulerSettings settings, boolean remoteSynced) {
}
