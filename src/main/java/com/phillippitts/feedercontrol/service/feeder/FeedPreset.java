package com.phillippitts.feedercontrol.service.feeder;

/**
 * Feeding parameters referenced by schedules.
 */
public record FeedPreset(String id, int amountGrams, int blowerDurationSeconds) {
}
