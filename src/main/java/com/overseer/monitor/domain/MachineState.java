package com.overseer.monitor.domain;

/** Lifecycle state reported for a machine. */
public enum MachineState {
    OFFLINE,
    IDLE,
    PAUSED,
    OPERATIONAL
}
