package com.phillippitts.feedercontrol.service.scheduler;

import com.phillippitts.feedercontrol.domain.SchedulerSettings;

/**
 * A named unit of periodic work run by {@link JobScheduler}.
 *
 * <p>Implementations are Spring beans; the scheduler picks up every one of them.
 */
public interface PeriodicJob {

    /** Unique job name, also used as the worker thread suffix and the {@code job} log key. */
    String name();

    /**
     * Interval between the end of one run and the start of the next.
     *
     * @param settings current interval settings
     * @return seconds; {@code 0} disables the job
     */
    int intervalSeconds(SchedulerSettings settings);

    /**
     * One iteration. Any exception is caught by the scheduler, logged and counted; the next
     * iteration still runs.
     */
    void run() throws Exception;
}
