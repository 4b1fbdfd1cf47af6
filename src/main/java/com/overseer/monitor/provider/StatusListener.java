package com.overseer.monitor.provider;

import com.overseer.monitor.domain.MachineStatus;

/** Callback a provider uses to report status. May be called from any thread, at any rate. */
@FunctionalInterface
public interface StatusListener {
    void onStatus(MachineStatus status);
}
