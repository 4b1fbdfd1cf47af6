package com.overseer.monitor.provider;

import com.overseer.monitor.common.OverseerException;

/**
 * Thrown by providers when a pause/resume/cancel fails on their side.
 * The core passes it through untouched.
 */
public class ProviderCommandException extends OverseerException {

    public ProviderCommandException(String message) {
        super(message);
    }

    public ProviderCommandException(String message, Object properties) {
        super(message, properties);
    }

    public ProviderCommandException(String message, Throwable cause) {
        super(message, null, cause);
    }
}
