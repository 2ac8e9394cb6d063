package com.phillippitts.feedercontrol.exception;

/**
 * Thrown by the remote store when it cannot be reached or answers with an error.
 * The settings source absorbs it and falls back to the local cache or defaults.
 */
public class ConfigUnavailableException extends FeederControlException {

    private final String path;

    public ConfigUnavailableException(String path, Throwable cause) {
        super("Remote store unavailable for path '" + path + "'", cause);
        this.path = path;
    }

    public ConfigUnavailableException(String path, String reason) {
        super("Remote store unavailable for path '" + path + "': " + reason);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
