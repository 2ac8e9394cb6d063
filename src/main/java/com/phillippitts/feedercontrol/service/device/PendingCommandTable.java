package com.phillippitts.feedercontrol.service.device;

import com.phillippitts.feedercontrol.exception.DeviceConnectionException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Commands awaiting device responses, keyed by id.
 *
 * <p>The table lock guards membership only; it is never held across I/O or while waiting.
 */
final class PendingCommandTable {

    private static final Logger LOG = LogManager.getLogger(PendingCommandTable.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<UUID, PendingCommand> entries = new LinkedHashMap<>();

    PendingCommand register(String commandText, ResponseRule rule, Instant deadline) {
        PendingCommand entry = new PendingCommand(commandText, rule, deadline);
        lock.lock();
        try {
            entries.put(entry.id(), entry);
        } finally {
            lock.unlock();
        }
        return entry;
    }

    void remove(UUID id) {
        lock.lock();
        try {
            entries.remove(id);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Offers an info line to every pending command.
     *
     * @return number of commands that accepted it
     */
    int offer(String infoLine) {
        int accepted = 0;
        for (PendingCommand entry : snapshot()) {
            if (entry.offer(infoLine)) {
                accepted++;
            }
        }
        return accepted;
    }

    /**
     * Releases and removes every entry whose deadline has passed.
     *
     * @return number of expired entries
     */
    int expireOverdue(Instant now) {
        List<PendingCommand> expired = new ArrayList<>();
        lock.lock();
        try {
            Iterator<PendingCommand> it = entries.values().iterator();
            while (it.hasNext()) {
                PendingCommand entry = it.next();
                if (now.isAfter(entry.deadline())) {
                    it.remove();
                    expired.add(entry);
                }
            }
        } finally {
            lock.unlock();
        }
        for (PendingCommand entry : expired) {
            LOG.debug("Pending command '{}' expired", entry.commandText());
            entry.expire();
        }
        return expired.size();
    }

    /** Fails and removes every entry, e.g. when the link drops. */
    void failAll(String reason) {
        List<PendingCommand> failed;
        lock.lock();
        try {
            failed = new ArrayList<>(entries.values());
            entries.clear();
        } finally {
            lock.unlock();
        }
        if (!failed.isEmpty()) {
            LOG.warn("Failing {} pending command(s): {}", failed.size(), reason);
        }
        for (PendingCommand entry : failed) {
            entry.fail(new DeviceConnectionException(reason));
        }
    }

    int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    private List<PendingCommand> snapshot() {
        lock.lock();
        try {
            return new ArrayList<>(entries.values());
        } finally {
            lock.unlock();
        }
    }
}
