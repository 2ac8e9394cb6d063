package com.phillippitts.feedercontrol.exception;

/**
 * Thrown when a manual settings update carries an unknown key or a value that is not a
 * non-negative integer. Scheduler state is left untouched.
 */
public class SettingsValidationException extends FeederControlException {

    private final String field;

    public SettingsValidationException(String field, String reason) {
        super("Invalid value for " + field + ": " + reason);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
