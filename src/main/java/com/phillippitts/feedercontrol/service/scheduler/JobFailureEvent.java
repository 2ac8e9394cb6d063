package com.phillippitts.feedercontrol.service.scheduler;

import java.time.Instant;

/**
 * Published when a job iteration throws.
 *
 * @param reason exception simple class name
 */
public record JobFailureEvent(String jobName, String reason, String message, Instant at) {
}
