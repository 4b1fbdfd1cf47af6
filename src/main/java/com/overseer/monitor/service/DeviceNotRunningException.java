package com.overseer.monitor.service;

import com.overseer.monitor.common.OverseerException;
import com.overseer.monitor.domain.MachineCommand;

import java.util.Map;

/** A command targeted a machine that has no running monitor. */
public class DeviceNotRunningException extends OverseerException {

    private final int machineId;

    public DeviceNotRunningException(int machineId, MachineCommand command) {
        super("Machine " + machineId + " is not being monitored, cannot " + command.name().toLowerCase(),
                Map.of("machineId", machineId, "command", command));
        this.machineId = machineId;
    }

    public int getMachineId() {
        return machineId;
    }
}
