package com.phillippitts.feedercontrol.service.device;

import com.phillippitts.feedercontrol.exception.DeviceConnectionException;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * An outstanding command waiting for response lines.
 *
 * <p>The waiter blocks on a one-shot latch that the reader thread releases when the response
 * rule is satisfied, the deadline passes, or the link is lost.
 */
final class PendingCommand {

    private final UUID id = UUID.randomUUID();
    private final String commandText;
    private final ResponseRule rule;
    private final Instant deadline;
    private final CountDownLatch done = new CountDownLatch(1);

    private final List<String> responses = new ArrayList<>();
    private DeviceConnectionException failure;
    private boolean expired;

    PendingCommand(String commandText, ResponseRule rule, Instant deadline) {
        this.commandText = commandText;
        this.rule = rule;
        this.deadline = deadline;
    }

    UUID id() {
        return id;
    }

    String commandText() {
        return commandText;
    }

    Instant deadline() {
        return deadline;
    }

    /**
     * Appends the line if the rule accepts it.
     *
     * @return {@code true} if the line was accepted
     */
    synchronized boolean offer(String infoLine) {
        if (isComplete() || !rule.accepts(infoLine)) {
            return false;
        }
        responses.add(infoLine);
        if (rule.isComplete(responses)) {
            done.countDown();
        }
        return true;
    }

    synchronized void fail(DeviceConnectionException cause) {
        if (!isComplete()) {
            failure = cause;
            done.countDown();
        }
    }

    synchronized void expire() {
        if (!isComplete()) {
            expired = true;
            done.countDown();
        }
    }

    boolean isComplete() {
        return done.getCount() == 0;
    }

    /**
     * Blocks until complete or the timeout elapses. Interruption ends the wait early.
     */
    boolean await(Duration timeout) {
        try {
            return done.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    synchronized CommandResult result(Duration timeout) {
        if (failure != null) {
            return CommandResult.failed(commandText, failure);
        }
        if (!isComplete() || expired) {
            return CommandResult.timedOut(commandText, timeout, responses);
        }
        return CommandResult.ok(commandText, responses);
    }
}
