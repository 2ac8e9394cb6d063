package com.phillippitts.feedercontrol.service.device;

import java.util.List;
import java.util.Locale;

/**
 * Decides which info lines belong to a pending command and when it has heard enough.
 */
public interface ResponseRule {

    boolean accepts(String infoLine);

    /**
     * @param responses lines accepted so far, in arrival order (never empty)
     */
    boolean isComplete(List<String> responses);

    /**
     * Rule for a command text. {@code sensors:status} replies with several lines ending with the
     * print interval; any other command completes on its first line mentioning the command family
     * (the text before the first ':').
     */
    static ResponseRule forCommand(String command) {
        if ("sensors:status".equals(command)) {
            return new ResponseRule() {
                @Override
                public boolean accepts(String infoLine) {
                    return infoLine.contains("Sensor service status:") || infoLine.contains("Print interval:");
                }

                @Override
                public boolean isComplete(List<String> responses) {
                    return responses.stream().anyMatch(l -> l.contains("Print interval:"));
                }
            };
        }
        String family = familyOf(command);
        return new ResponseRule() {
            @Override
            public boolean accepts(String infoLine) {
                // an empty family would otherwise claim every info line
                return !family.isEmpty() && infoLine.toLowerCase(Locale.ROOT).contains(family);
            }

            @Override
            public boolean isComplete(List<String> responses) {
                return true;
            }
        };
    }

    /** Lower-cased text before the first ':' of a command, e.g. {@code relay} for {@code relay:fan:on}. */
    static String familyOf(String command) {
        int colon = command.indexOf(':');
        String family = colon < 0 ? command : command.substring(0, colon);
        return family.trim().toLowerCase(Locale.ROOT);
    }
}
