package com.overseer.monitor.common;

/** A machine id that is not registered. */
public class NotFoundException extends OverseerException {

    public NotFoundException(String message, Object properties) {
        super(message, properties);
    }
}
