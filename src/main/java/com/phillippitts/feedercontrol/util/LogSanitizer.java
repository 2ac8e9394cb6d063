package com.phillippitts.feedercontrol.util;

/** Utility for safe logging of raw device lines and command text. */
public final class LogSanitizer {
    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null) {
            return "";
        }
        if (max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Replaces control characters (CR, LF, tabs, stray bytes from a noisy serial line) with '?'
     * and truncates, so one device line always logs as one log line.
     */
    public static String printable(String s, int max) {
        String cut = truncate(s, max);
        StringBuilder sb = new StringBuilder(cut.length());
        for (int i = 0; i < cut.length(); i++) {
            char c = cut.charAt(i);
            sb.append(Character.isISOControl(c) ? '?' : c);
        }
        return sb.toString();
    }
}
