package com.phillippitts.feedercontrol.exception;

import java.time.Duration;

/**
 * Thrown when the device sends no complete response to a command within its deadline.
 * Surfaced to the caller; never retried automatically.
 */
public class CommandTimeoutException extends FeederControlException {

    private final String command;
    private final Duration timeout;

    public CommandTimeoutException(String command, Duration timeout) {
        super("No response to command '" + command + "' within " + timeout.toMillis() + "ms");
        this.command = command;
        this.timeout = timeout;
    }

    public String getCommand() {
        return command;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
