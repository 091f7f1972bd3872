package org.hardshell.share;

import java.util.Locale;

/**
 * What the loader does when it finds a debugger attached. The check is advisory.
 */
public enum DebuggerPolicy {
    IGNORE,
    LOG_ONLY,
    ABORT;

    public static DebuggerPolicy fromName(String name, DebuggerPolicy fallback) {
        if (name == null || name.isEmpty()) return fallback;
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return fallback;
        }
    }
}
