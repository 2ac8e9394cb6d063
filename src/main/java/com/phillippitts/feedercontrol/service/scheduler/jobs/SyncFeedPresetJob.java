package com.phillippitts.feedercontrol.service.scheduler.jobs;

import com.phillippitts.feedercontrol.domain.SchedulerSettings;
import com.phillippitts.feedercontrol.service.feeder.FeedScheduleCache;
import com.phillippitts.feedercontrol.service.remote.RemoteStore;
import com.phillippitts.feedercontrol.service.scheduler.PeriodicJob;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Pulls {@code feed_preset_data} into the {@link FeedScheduleCache}.
 */
@Component
public class SyncFeedPresetJob implements PeriodicJob {

    private static final Logger LOG = LogManager.getLogger(SyncFeedPresetJob.class);

    private final RemoteStore remote;
    private final FeedScheduleCache cache;

    public SyncFeedPresetJob(RemoteStore remote, FeedScheduleCache cache) {
        this.remote = remote;
        this.cache = cache;
    }

    @Override
    public String name() {
        return SchedulerSettings.SYNC_FEED_PRESET;
    }

    @Override
    public int intervalSeconds(SchedulerSettings settings) {
        return settings.syncFeedPreset();
    }

    @Override
    public void run() {
        Optional<Object> data = remote.get("feed_preset_data");
        if (data.isEmpty()) {
            LOG.warn("No feed_preset_data in remote store; keeping {} cached preset(s)", cache.presets().size());
            return;
        }
        LOG.info("Feed preset data synced: {} preset(s)", cache.replacePresets(data.get()));
    }
}
