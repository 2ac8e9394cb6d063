package com.phillippitts.feedercontrol.service.device;

import java.time.Instant;

/**
 * Point-in-time view of the device link for status endpoints and health checks.
 *
 * @param lastFrameAt when the last data frame arrived, {@code null} if none yet
 */
public record LinkStatus(
        LinkState state,
        String address,
        boolean connected,
        int reconnectAttempts,
        String lastError,
        int pendingCommands,
        Instant lastFrameAt
) {
}
