package com.phillippitts.feedercontrol.service.feeder;

/**
 * Runs one feeding routine on the device.
 */
public interface FeederActuator {

    /**
     * @param feedSizeGrams food to dispense, measured by weight reduction
     * @param blowerDurationSeconds how long the blower runs after dispensing
     * @return {@code true} if the device accepted the routine
     */
    boolean startFeeding(int feedSizeGrams, int blowerDurationSeconds);
}
