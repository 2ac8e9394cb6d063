package com.phillippitts.feedercontrol.service.scheduler;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One worker owned by {@link JobScheduler}.
 *
 * <p>When a stop outlives the join timeout the descriptor is marked orphaned and the worker
 * itself starts its replacement once its body returns. Exactly one side wins the
 * {@link #markExited()} / {@link #markOrphaned()} race.
 */
final class JobDescriptor {

    private static final int RUNNING = 0;
    private static final int EXITED = 1;
    private static final int ORPHANED = 2;

    private final String name;
    private final Duration interval;
    private final CountDownLatch stopSignal;
    private final Thread worker;
    private final AtomicInteger state = new AtomicInteger(RUNNING);

    JobDescriptor(String name, Duration interval, CountDownLatch stopSignal, Thread worker) {
        this.name = name;
        this.interval = interval;
        this.stopSignal = stopSignal;
        this.worker = worker;
    }

    String name() {
        return name;
    }

    Duration interval() {
        return interval;
    }

    /** Counted down once to ask the worker to finish. */
    CountDownLatch stopSignal() {
        return stopSignal;
    }

    Thread worker() {
        return worker;
    }

    boolean isAlive() {
        return worker.isAlive();
    }

    boolean isOrphaned() {
        return state.get() == ORPHANED;
    }

    /**
     * Called by the worker when its body returns.
     *
     * @return {@code false} if the descriptor was orphaned first, so the worker owes a replacement
     */
    boolean markExited() {
        return state.compareAndSet(RUNNING, EXITED) || state.get() == EXITED;
    }

    /**
     * Called by a stopper whose join timed out.
     *
     * @return {@code true} if the worker is still inside its body and will replace itself
     */
    boolean markOrphaned() {
        return state.compareAndSet(RUNNING, ORPHANED) || state.get() == ORPHANED;
    }
}
