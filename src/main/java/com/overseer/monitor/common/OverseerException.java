package com.overseer.monitor.common;

import lombok.Getter;

import java.util.Optional;

/**
 * Error whose message is meant for the user. {@code properties} carries extra context
 * (machine id, command, ...) that the web layer serializes next to the message.
 */
@Getter
public class OverseerException extends RuntimeException {

    private final transient Object properties;

    public OverseerException(String message) {
        this(message, null, null);
    }

    public OverseerException(String message, Object properties) {
        this(message, properties, null);
    }

    public OverseerException(String message, Object properties, Throwable cause) {
        super(message, cause);
        this.properties = properties;
    }

    /** Finds the first OverseerException in the cause chain of {@code t}, including {@code t} itself. */
    public static Optional<OverseerException> unwrap(Throwable t) {
        for (Throwable c = t; c != null; c = c.getCause()) {
            if (c instanceof OverseerException oe) return Optional.of(oe);
            if (c.getCause() == c) break;
        }
        return Optional.empty();
    }
}
