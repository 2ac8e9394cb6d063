package com.phillippitts.feedercontrol.service.device;

import java.time.Instant;

/**
 * Published on every device link state transition.
 *
 * @param address serial address involved, may be {@code null} before discovery
 * @param reason short cause for the transition, may be {@code null}
 */
public record LinkStateChangedEvent(LinkState from, LinkState to, String address, String reason, Instant at) {
}
