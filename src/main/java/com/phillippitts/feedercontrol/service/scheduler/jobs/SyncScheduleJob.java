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
 * Pulls {@code schedule_data} into the {@link FeedScheduleCache}.
 */
@Component
public class SyncScheduleJob implements PeriodicJob {

    private static final Logger LOG = LogManager.getLogger(SyncScheduleJob.class);

    private final RemoteStore remote;
    private final FeedScheduleCache cache;

    public SyncScheduleJob(RemoteStore remote, FeedScheduleCache cache) {
        this.remote = remote;
        this.cache = cache;
    }

    @Override
    public String name() {
        return SchedulerSettings.SYNC_SCHEDULE;
    }

    @Override
    public int intervalSeconds(SchedulerSettings settings) {
        return settings.syncSchedule();
    }

    @Override
    public void run() {
        Optional<Object> data = remote.get("schedule_data");
        if (data.isEmpty()) {
            LOG.warn("No schedule_data in remote store; keeping {} cached schedule(s)", cache.schedules().size());
            return;
        }
        LOG.info("Schedule data synced: {} schedule(s)", cache.replaceSchedules(data.get()));
    }
}
