package com.phillippitts.feedercontrol.domain;

import java.util.Locale;

/**
 * Audit-log action recorded on an alert lifecycle transition.
 */
public enum AlertAction {
    TRIGGER,
    ESCALATE,
    RESOLVE;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
