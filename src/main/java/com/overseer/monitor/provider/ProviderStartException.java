package com.overseer.monitor.provider;

import com.overseer.monitor.common.OverseerException;

import java.util.Map;

/** A provider could not begin monitoring (bad credentials, unreachable host, unknown type). */
public class ProviderStartException extends OverseerException {

    private final int machineId;

    public ProviderStartException(int machineId, String message) {
        this(machineId, message, null);
    }

    public ProviderStartException(int machineId, String message, Throwable cause) {
        super(message, Map.of("machineId", machineId), cause);
        this.machineId = machineId;
    }

    public int getMachineId() {
        return machineId;
    }
}
