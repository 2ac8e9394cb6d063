package com.phillippitts.feedercontrol.service.events;

import com.phillippitts.feedercontrol.service.device.LinkState;
import com.phillippitts.feedercontrol.service.device.LinkStateChangedEvent;
import com.phillippitts.feedercontrol.service.scheduler.JobFailureEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized operator-facing summary of failures. Throttled to avoid log spam from jobs that
 * fail every second while a collaborator is down.
 */
@Component
class ErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onJobFailure(JobFailureEvent e) {
        String key = "job-" + e.jobName() + '-' + e.reason();
        if (shouldLog(key)) {
            LOG.warn("Job {} is failing: {} ({}). Further identical failures are summarized for {}s.",
                    e.jobName(), e.reason(), e.message(), THROTTLE.toSeconds());
        }
    }

    @EventListener
    void onLinkStateChanged(LinkStateChangedEvent e) {
        if (e.to() != LinkState.DISCONNECTED || e.from() != LinkState.CONNECTED) {
            return;
        }
        if (shouldLog("link-lost")) {
            LOG.warn("Feeder device disconnected from {} ({}). Check the USB cable; reconnecting automatically.",
                    e.address(), e.reason());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
