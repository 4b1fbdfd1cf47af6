package com.overseer.monitor.service;

import com.overseer.monitor.domain.MachineStatus;

/**
 * Receives every status accepted into the current-state table, in acceptance order per
 * machine and at most once per status id. Called while the machine's entry is locked,
 * so implementations must return quickly.
 */
@FunctionalInterface
public interface StatusSubscriber {
    void onStatus(MachineStatus status);
}
