package com.phillippitts.feedercontrol.service.scheduler;

import com.phillippitts.feedercontrol.config.properties.SchedulerProperties;
import com.phillippitts.feedercontrol.domain.SchedulerSettings;
import com.phillippitts.feedercontrol.exception.SettingsValidationException;
import com.phillippitts.feedercontrol.exception.TransientJobException;
import com.phillippitts.feedercontrol.service.metrics.FeederMetrics;
import com.phillippitts.feedercontrol.service.settings.ConfigSource;
import com.phillippitts.feedercontrol.util.TimeUtils;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Runs every {@link PeriodicJob} on its own worker thread and reloads intervals at runtime.
 *
 * <p>Threading model:
 * <ul>
 *   <li>One platform thread per enabled job, looping {@code run(); await(stop, interval)}.</li>
 *   <li>One settings-watch worker, registered like a job under {@value #SETTINGS_WATCH}. Every
 *       {@code scheduler.watch-period} it re-reads the settings and, on a change, restarts every
 *       worker except itself. Workers are told apart by thread identity, never by name.</li>
 *   <li>{@code start}, {@code stop} and restarts are serialised by one lifecycle lock. The watch
 *       acquires it with a timed {@code tryLock} loop that also observes its own stop signal, so a
 *       concurrent {@link #stop()} can always join it.</li>
 * </ul>
 *
 * <p>At most one live worker exists per name: starting a name whose worker is still alive is
 * skipped with a warning. A worker that outlives the join timeout of a restart starts its own
 * replacement as soon as its body returns, and the watch revives any registered worker that
 * died, so a slow job is delayed but never dropped.
 */
@Component
public class JobScheduler {

    private static final Logger LOG = LogManager.getLogger(JobScheduler.class);

    public static final String SETTINGS_WATCH = "settingsWatch";

    private static final long LOCK_POLL_MILLIS = 100;

    private final List<PeriodicJob> jobs;
    private final ConfigSource configSource;
    private final SchedulerProperties props;
    private final ApplicationEventPublisher publisher;
    private final FeederMetrics metrics;
    private final ThreadFactory threadFactory;

    private final ReentrantLock lifecycleLock = new ReentrantLock();
    private final Object settingsLock = new Object();
    // Mutated under lifecycleLock only
    private final Map<String, JobDescriptor> registry = new ConcurrentHashMap<>();

    private SchedulerSettings settings = SchedulerSettings.defaults();
    private volatile boolean running;

    public JobScheduler(List<PeriodicJob> jobs,
                        ConfigSource configSource,
                        SchedulerProperties props,
                        ApplicationEventPublisher publisher,
                        FeederMetrics metrics,
                        @Qualifier("schedulerThreadFactory") ThreadFactory threadFactory) {
        this.jobs = List.copyOf(jobs);
        this.configSource = Objects.requireNonNull(configSource, "configSource");
        this.props = Objects.requireNonNull(props, "props");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.threadFactory = Objects.requireNonNull(threadFactory, "threadFactory");
        LOG.info("Scheduler initialized with jobs={}", jobs.stream().map(PeriodicJob::name).toList());
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (props.isAutoStart()) {
            start();
        } else {
            LOG.info("Scheduler auto-start disabled (scheduler.auto-start=false)");
        }
    }

    @PreDestroy
    void shutdown() {
        if (running) {
            stop();
        }
    }

    /**
     * Loads settings, starts one worker per job with a positive interval, then the settings watch.
     * Logs a warning and does nothing if already running.
     */
    public void start() {
        lifecycleLock.lock();
        try {
            if (running) {
                LOG.warn("Scheduler is already running");
                return;
            }
            SchedulerSettings loaded = configSource.loadSettings();
            setSettings(loaded);
            running = true;
            LOG.info("Starting scheduler with settings {}", loaded.toMap());
            startJobs(loaded);
            startWatch();
        } finally {
            lifecycleLock.unlock();
        }
    }

    /**
     * Signals every worker and joins each one with a bounded timeout. The caller's own worker, if
     * any, is signalled but never joined.
     */
    public void stop() {
        lifecycleLock.lock();
        try {
            if (!running) {
                LOG.warn("Scheduler is not running");
                return;
            }
            running = false;
            LOG.info("Stopping scheduler");
            stopWorkers(d -> true);
            LOG.info("Scheduler stopped");
        } finally {
            lifecycleLock.unlock();
        }
    }

    /**
     * Validates and applies a partial settings update, persists it, and restarts the workers if
     * the scheduler is running.
     *
     * @param partial subset of {@link SchedulerSettings#KEYS} to change
     * @throws SettingsValidationException on an unknown key or a value that is not a non-negative
     *         integer; nothing is changed in that case
     */
    public SettingsUpdateResult updateSettingsManually(Map<String, ?> partial) {
        lifecycleLock.lock();
        try {
            SchedulerSettings merged = currentSettings().mergedWith(partial);
            setSettings(merged);
            boolean remoteSynced = configSource.saveSettings(merged);
            if (running) {
                metrics.incrementRestart("manual");
                restartWorkers(merged);
            }
            LOG.info("Settings updated manually: {} (remoteSynced={})", merged.toMap(), remoteSynced);
            return new SettingsUpdateResult(merged, remoteSynced);
        } finally {
            lifecycleLock.unlock();
        }
    }

    public SchedulerSettings currentSettings() {
        synchronized (settingsLock) {
            return settings;
        }
    }

    public boolean isRunning() {
        return running;
    }

    public SchedulerStatus status() {
        List<JobDescriptor> live = registry.values().stream().filter(JobDescriptor::isAlive).toList();
        List<String> names = live.stream().map(JobDescriptor::name).sorted().toList();
        return new SchedulerStatus(running, currentSettings(), names, live.size());
    }

    private void setSettings(SchedulerSettings next) {
        synchronized (settingsLock) {
            settings = next;
        }
    }

    private void startJobs(SchedulerSettings current) {
        for (PeriodicJob job : jobs) {
            startJob(job, current);
        }
    }

    private void startJob(PeriodicJob job, SchedulerSettings current) {
        int interval = job.intervalSeconds(current);
        if (interval <= 0) {
            LOG.info("Job {} disabled (interval {})", job.name(), interval);
            return;
        }
        Duration period = Duration.ofSeconds(interval);
        startWorker(job.name(), period, stop -> runJobLoop(job, period, stop));
    }

    private void startWatch() {
        startWorker(SETTINGS_WATCH, props.getWatchPeriod(), this::watchLoop);
    }

    /** Starts the named worker again from the current settings. Caller holds the lifecycle lock. */
    private void startByName(String name) {
        if (SETTINGS_WATCH.equals(name)) {
            startWatch();
            return;
        }
        jobs.stream()
                .filter(job -> job.name().equals(name))
                .findFirst()
                .ifPresent(job -> startJob(job, currentSettings()));
    }

    /** Stops all workers except the caller's own, then starts everything that is not running. */
    private void restartWorkers(SchedulerSettings current) {
        Thread self = Thread.currentThread();
        stopWorkers(d -> d.worker() != self);
        startJobs(current);
        startWatch();
    }

    private boolean startWorker(String name, Duration interval, Consumer<CountDownLatch> body) {
        JobDescriptor existing = registry.get(name);
        if (existing != null && existing.isAlive()) {
            if (existing.worker() != Thread.currentThread()) {
                LOG.warn("Worker {} is still alive; not starting another", name);
            }
            return false;
        }
        CountDownLatch stop = new CountDownLatch(1);
        AtomicReference<JobDescriptor> self = new AtomicReference<>();
        Thread worker = threadFactory.newThread(() -> {
            ThreadContext.put("job", name);
            try {
                body.accept(stop);
            } finally {
                JobDescriptor descriptor = self.get();
                if (descriptor != null && !descriptor.markExited()) {
                    replaceOrphan(descriptor);
                }
                ThreadContext.clearAll();
            }
        });
        worker.setName(props.getThreadNamePrefix() + name);
        JobDescriptor descriptor = new JobDescriptor(name, interval, stop, worker);
        self.set(descriptor);
        registry.put(name, descriptor);
        worker.start();
        LOG.info("Started {} with {}s interval", name, interval.toMillis() / 1000.0);
        return true;
    }

    private void stopWorkers(Predicate<JobDescriptor> selected) {
        List<JobDescriptor> targets = registry.values().stream().filter(selected).toList();
        targets.forEach(d -> d.stopSignal().countDown());
        Thread self = Thread.currentThread();
        long joinMillis = props.getJoinTimeout().toMillis();
        for (JobDescriptor d : targets) {
            if (d.worker() == self) {
                continue;
            }
            try {
                d.worker().join(joinMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (d.isAlive() && d.markOrphaned()) {
                LOG.warn("Worker {} did not stop within {}ms; it will be replaced when it exits", d.name(), joinMillis);
            } else {
                registry.remove(d.name(), d);
            }
        }
    }

    /**
     * Runs on an orphaned worker after its body returned: unregisters it and, while the scheduler
     * is running, starts its replacement. Gives up if the scheduler stops first.
     */
    private void replaceOrphan(JobDescriptor orphan) {
        while (running) {
            try {
                if (!lifecycleLock.tryLock(LOCK_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                    continue;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            try {
                if (registry.remove(orphan.name(), orphan) && running) {
                    LOG.info("Replacing worker {} that outlived its stop", orphan.name());
                    startByName(orphan.name());
                }
            } finally {
                lifecycleLock.unlock();
            }
            return;
        }
        LOG.debug("Scheduler stopped before worker {} could be replaced", orphan.name());
    }

    /** Restarts registered workers whose thread died without being stopped. Caller holds the lifecycle lock. */
    private void reviveDeadWorkers() {
        for (JobDescriptor d : List.copyOf(registry.values())) {
            if (!d.isAlive() && !d.isOrphaned() && registry.remove(d.name(), d)) {
                LOG.warn("Worker {} is no longer alive; restarting it", d.name());
                startByName(d.name());
            }
        }
    }

    private void runJobLoop(PeriodicJob job, Duration interval, CountDownLatch stop) {
        while (stop.getCount() > 0) {
            runOnce(job);
            if (TimeUtils.awaitStop(stop, interval)) {
                break;
            }
        }
        LOG.debug("Job {} exited", job.name());
    }

    private void runOnce(PeriodicJob job) {
        long start = System.nanoTime();
        try {
            job.run();
            metrics.recordJobRun(job.name(), System.nanoTime() - start);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            TransientJobException failure = new TransientJobException(job.name(), e);
            LOG.error(failure.getMessage(), e);
            metrics.incrementJobFailure(job.name(), e.getClass().getSimpleName());
            publisher.publishEvent(new JobFailureEvent(job.name(), e.getClass().getSimpleName(), e.getMessage(), Instant.now()));
        }
    }

    private void watchLoop(CountDownLatch stop) {
        while (!TimeUtils.awaitStop(stop, props.getWatchPeriod())) {
            try {
                checkForSettingsChange(stop);
            } catch (RuntimeException e) {
                LOG.error("Settings watch cycle failed: {}", e.toString(), e);
            }
        }
        LOG.debug("Settings watch exited");
    }

    private void checkForSettingsChange(CountDownLatch stop) {
        SchedulerSettings loaded = configSource.loadSettings();
        boolean deadWorkers = registry.values().stream().anyMatch(d -> !d.isAlive() && !d.isOrphaned());
        if (loaded.equals(currentSettings()) && !deadWorkers) {
            return;
        }
        if (!acquireLifecycleLock(stop)) {
            return;
        }
        try {
            if (!running || stop.getCount() == 0) {
                return;
            }
            if (loaded.equals(currentSettings())) {
                reviveDeadWorkers();
                return;
            }
            LOG.info("Settings changed {} -> {}; restarting jobs", currentSettings().toMap(), loaded.toMap());
            setSettings(loaded);
            metrics.incrementRestart("watch");
            restartWorkers(loaded);
        } finally {
            lifecycleLock.unlock();
        }
    }

    /**
     * @return {@code true} with the lock held, {@code false} if the stop signal fired first
     */
    private boolean acquireLifecycleLock(CountDownLatch stop) {
        while (stop.getCount() > 0) {
            try {
                if (lifecycleLock.tryLock(LOCK_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                    return true;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return false;
    }
}
