package com.overseer.monitor.provider;

import com.overseer.monitor.domain.MachineRegistration;

/**
 * Integration with one kind of machine (OctoPrint, Klipper, Bambu, ...).
 *
 * <p>One instance monitors exactly one machine and lives between one {@link #start} and
 * the matching {@link #stop}. Push-based providers report through the listener whenever
 * the machine tells them something, and should re-send the current status at least once
 * per interval while the machine is idle; a provider that stays silent longer than the
 * liveness window is shown as Offline.</p>
 *
 * <p>Providers that need to be asked for status implement {@link PollingMachineProvider};
 * the host then polls them on its own schedule.</p>
 */
public interface MachineProvider {

    /**
     * Begin monitoring. Network I/O started here should use timeouts no longer than
     * {@code intervalMs}, so {@link #stop()} never hangs.
     *
     * @throws ProviderStartException if the machine cannot be monitored at all
     */
    void start(MachineRegistration machine, int intervalMs, StatusListener listener);

    /** Stop monitoring and release connections. Called once per successful start. */
    void stop();

    void pauseJob();

    void resumeJob();

    void cancelJob();
}
