package com.phillippitts.feedercontrol.service.feeder;

/**
 * A daily feeding slot.
 *
 * @param time local wall-clock time, {@code HH:mm}
 */
public record FeedSchedule(String id, String time, String presetId, boolean enabled) {
}
