package com.overseer.monitor.provider;

import com.overseer.monitor.domain.MachineStatus;

/** A provider that has to be asked for status; the host calls {@link #poll()} once per interval. */
public interface PollingMachineProvider extends MachineProvider {

    /**
     * Fetch the current status.
     *
     * @return the status, or {@code null} when there is nothing new to report
     * @throws Exception transient failures (timeouts, connection resets); the host logs
     *                   them and polls again on the next tick
     */
    MachineStatus poll() throws Exception;
}
