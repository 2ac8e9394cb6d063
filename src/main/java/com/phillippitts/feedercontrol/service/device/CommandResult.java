package com.phillippitts.feedercontrol.service.device;

import com.phillippitts.feedercontrol.exception.CommandTimeoutException;
import com.phillippitts.feedercontrol.exception.DeviceConnectionException;
import com.phillippitts.feedercontrol.exception.FeederControlException;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of a command that waited for device responses.
 *
 * <p>A timed-out result still carries the lines received before the deadline.
 *
 * @param failure {@code null} on success; a {@link CommandTimeoutException} or
 *                {@link DeviceConnectionException} otherwise
 */
public record CommandResult(boolean success, String command, List<String> responses, FeederControlException failure) {

    public CommandResult {
        responses = List.copyOf(responses);
    }

    public static CommandResult ok(String command, List<String> responses) {
        return new CommandResult(true, command, responses, null);
    }

    public static CommandResult timedOut(String command, Duration timeout, List<String> partial) {
        return new CommandResult(false, command, partial, new CommandTimeoutException(command, timeout));
    }

    public static CommandResult failed(String command, DeviceConnectionException cause) {
        return new CommandResult(false, command, List.of(), cause);
    }

    /** Failure message, {@code null} on success. */
    public String error() {
        return failure == null ? null : failure.getMessage();
    }

    public boolean timedOut() {
        return failure instanceof CommandTimeoutException;
    }

    /**
     * @return the response lines
     * @throws FeederControlException the recorded failure
     */
    public List<String> orThrow() {
        if (failure != null) {
            throw failure;
        }
        return responses;
    }
}
