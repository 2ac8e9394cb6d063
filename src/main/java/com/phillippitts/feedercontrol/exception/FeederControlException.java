package com.phillippitts.feedercontrol.exception;

/**
 * Base exception for all feeder-control application errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class FeederControlException extends RuntimeException {

    public FeederControlException(String message) {
        super(message);
    }

    public FeederControlException(String message, Throwable cause) {
        super(message, cause);
    }

    public FeederControlException(Throwable cause) {
        super(cause);
    }
}
