package com.overseer.monitor.domain;

import java.util.Locale;

/** Job commands a caller can route to a running machine. */
public enum MachineCommand {
    PAUSE,
    RESUME,
    CANCEL;

    /** Case-insensitive lookup used by the web layer ("pause", "Resume", ...). */
    public static MachineCommand parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("command is required");
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown command: " + raw);
        }
    }
}
