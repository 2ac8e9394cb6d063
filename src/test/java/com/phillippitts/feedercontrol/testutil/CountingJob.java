package com.phillippitts.feedercontrol.testutil;

import com.phillippitts.feedercontrol.domain.SchedulerSettings;
import com.phillippitts.feedercontrol.service.scheduler.PeriodicJob;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.ToIntFunction;

/**
 * Periodic job that counts its runs and can be told to fail.
 */
public class CountingJob implements PeriodicJob {

    private final String name;
    private final ToIntFunction<SchedulerSettings> interval;
    private final AtomicInteger runs = new AtomicInteger();
    private volatile RuntimeException failure;

    public CountingJob(String name, ToIntFunction<SchedulerSettings> interval) {
        this.name = name;
        this.interval = interval;
    }

    /** Job whose interval is the settings field named like the job. */
    public static CountingJob forSetting(String key) {
        return new CountingJob(key, s -> s.intervalFor(key));
    }

    public static CountingJob fixed(String name, int seconds) {
        return new CountingJob(name, s -> seconds);
    }

    public void failWith(RuntimeException failure) {
        this.failure = failure;
    }

    public int runs() {
        return runs.get();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public int intervalSeconds(SchedulerSettings settings) {
        return interval.applyAsInt(settings);
    }

    @Override
    public void run() {
        runs.incrementAndGet();
        RuntimeException f = failure;
        if (f != null) {
            throw f;
        }
    }
}
