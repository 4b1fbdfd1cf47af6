package com.overseer.monitor.service;

import com.overseer.monitor.domain.MachineCommand;
import com.overseer.monitor.domain.MachineRegistration;
import com.overseer.monitor.domain.MachineStatus;
import com.overseer.monitor.provider.MachineProvider;
import com.overseer.monitor.provider.MachineProviderRegistry;
import com.overseer.monitor.provider.PollingMachineProvider;
import com.overseer.monitor.provider.ProviderStartException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * One running incarnation (generation) of a machine monitor.
 *
 * <p>Every status for the machine, whether pushed by the provider, returned by a poll or
 * synthesized on silence, goes through a single-thread delivery queue, so the reconciler
 * sees this handle's statuses in the order they were produced. A polling provider gets its
 * own poll thread, so a slow device only ever delays itself.</p>
 *
 * <p>A handle is started once and stopped once; restarting a machine means a new handle
 * with a new generation.</p>
 */
@Slf4j
public class ProviderHandle {

    @Getter private final MachineRegistration machine;
    @Getter private final long generation;

    private final MachineProviderRegistry registry;
    private final StateReconciler reconciler;
    private final Clock clock;
    private final long stopAwaitMs;

    // ==== Lifecycle ====
    private final Object lifecycleLock = new Object();
    private volatile boolean open;        // statuses are being taken in
    private volatile boolean running;     // start() succeeded, stop() not yet called
    private boolean used;                 // start() was attempted
    private MachineProvider provider;
    private ThreadPoolExecutor delivery;
    private ScheduledThreadPoolExecutor pollLoop;   // null for push providers

    // ==== Liveness ====
    private final Object livenessLock = new Object();   // lastSeenMs + offlineDeclared change together
    @Getter private volatile long lastSeenMs;
    @Getter private volatile MachineStatus lastAccepted;
    private volatile boolean offlineDeclared;
    private volatile int pollFailureStreak;

    public ProviderHandle(MachineRegistration machine,
                          long generation,
                          MachineProviderRegistry registry,
                          StateReconciler reconciler,
                          Clock clock,
                          long stopAwaitMs) {
        this.machine = machine;
        this.generation = generation;
        this.registry = registry;
        this.reconciler = reconciler;
        this.clock = clock;
        this.stopAwaitMs = stopAwaitMs;
    }

    public int getMachineId() {
        return machine.getId();
    }

    public boolean isRunning() {
        return running;
    }

    public boolean isOfflineDeclared() {
        return offlineDeclared;
    }

    // ---- Lifecycle ----

    /**
     * Create the provider and start it.
     *
     * @throws ProviderStartException if the provider cannot be created or refuses to start
     */
    public void start() {
        synchronized (lifecycleLock) {
            if (used) throw new IllegalStateException("handle for machine " + getMachineId() + " gen " + generation + " already used");
            used = true;

            MachineProvider p = registry.create(machine);
            delivery = newDeliveryQueue();
            reconciler.activate(getMachineId(), generation);
            lastSeenMs = clock.millis();
            open = true;

            try {
                p.start(machine, machine.getPollIntervalMs(), this::onProviderStatus);
            } catch (RuntimeException e) {
                open = false;
                reconciler.retire(getMachineId(), generation);
                delivery.shutdownNow();
                if (e instanceof ProviderStartException pse) throw pse;
                throw new ProviderStartException(getMachineId(),
                        "Machine " + getMachineId() + " (" + machine.getMachineType() + ") failed to start: " + e.getMessage(), e);
            }

            provider = p;
            running = true;
            if (p instanceof PollingMachineProvider poller) {
                pollLoop = new ScheduledThreadPoolExecutor(1, threads("poll"));
                pollLoop.scheduleWithFixedDelay(() -> pollOnce(poller),
                        0, machine.getPollIntervalMs(), TimeUnit.MILLISECONDS);
            }
            log.info("handle_started machine={} type={} gen={} intervalMs={} mode={}",
                    getMachineId(), machine.getMachineType(), generation, machine.getPollIntervalMs(),
                    pollLoop != null ? "poll" : "push");
        }
    }

    /**
     * Stop polling, stop the provider and wait for in-flight deliveries. Safe to call more
     * than once. A poll that is still running is waited for (up to {@code stopAwaitMs})
     * before the provider is stopped. When this returns, nothing from this generation
     * reaches the reconciler any more.
     */
    public void stop() {
        synchronized (lifecycleLock) {
            if (!running) return;
            running = false;
            open = false;

            if (pollLoop != null) {
                pollLoop.shutdownNow();   // cancels the loop, interrupts a blocked poll
                if (!awaitQuiet(pollLoop)) {
                    log.warn("poll_not_quiescent machine={} gen={} waitedMs={} -> stopping provider anyway",
                            getMachineId(), generation, stopAwaitMs);
                }
            }

            try {
                provider.stop();
            } catch (RuntimeException e) {
                log.warn("provider_stop_failed machine={} gen={} err={}", getMachineId(), generation, e.toString());
            }

            reconciler.retire(getMachineId(), generation);

            delivery.shutdown();
            if (!awaitQuiet(delivery)) {
                log.warn("delivery_not_quiescent machine={} gen={} waitedMs={} -> dropping {} queued",
                        getMachineId(), generation, stopAwaitMs, delivery.getQueue().size());
                delivery.shutdownNow();
            }
            log.info("handle_stopped machine={} gen={}", getMachineId(), generation);
        }
    }

    // ---- Commands ----

    /**
     * Run a job command on the provider. Commands for one machine run one at a time and
     * never overlap with {@link #stop()}. Provider exceptions propagate unchanged.
     */
    public void execute(MachineCommand command) {
        synchronized (lifecycleLock) {
            if (!running) throw new DeviceNotRunningException(getMachineId(), command);
            switch (command) {
                case PAUSE -> provider.pauseJob();
                case RESUME -> provider.resumeJob();
                case CANCEL -> provider.cancelJob();
            }
        }
    }

    // ---- Status intake ----

    private void onProviderStatus(MachineStatus status) {
        if (status == null) return;
        if (!open) {
            log.debug("status_after_stop machine={} gen={} id={}", getMachineId(), generation, status.getId());
            return;
        }
        if (status.getMachineId() != getMachineId()) {
            log.warn("status_foreign machine={} gen={} reportedMachine={} -> dropped",
                    getMachineId(), generation, status.getMachineId());
            return;
        }
        synchronized (livenessLock) {
            lastSeenMs = clock.millis();
            offlineDeclared = false;
        }
        enqueue(() -> deliver(status));
    }

    private void deliver(MachineStatus status) {
        if (!open) return;
        if (reconciler.accept(getMachineId(), generation, status)) {
            lastAccepted = status;
        }
    }

    private void pollOnce(PollingMachineProvider poller) {
        if (!open) return;
        try {
            MachineStatus s = poller.poll();
            if (pollFailureStreak > 0) {
                log.info("poll_recovered machine={} gen={} after={} failures", getMachineId(), generation, pollFailureStreak);
                pollFailureStreak = 0;
            }
            onProviderStatus(s);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            if (!open) return; // stop() raced the poll
            pollFailureStreak++;
            log.warn("poll_failed machine={} gen={} streak={} err={}", getMachineId(), generation, pollFailureStreak, e.toString());
        }
    }

    // ---- Liveness ----

    /**
     * Called by the liveness ticker. If nothing arrived for longer than {@code windowMs},
     * queue an Offline status behind whatever is already waiting for delivery.
     *
     * @return true if an Offline status was queued
     */
    boolean checkLiveness(long windowMs) {
        if (!open) return false;
        synchronized (livenessLock) {
            if (offlineDeclared) return false;
            if (clock.millis() - lastSeenMs <= windowMs) return false;
            offlineDeclared = true;
        }
        return enqueue(() -> declareOfflineIfStillSilent(windowMs));
    }

    private void declareOfflineIfStillSilent(long windowMs) {
        if (!open) return;
        long silentMs;
        synchronized (livenessLock) {
            silentMs = clock.millis() - lastSeenMs;
            if (silentMs <= windowMs) {
                // something arrived while this was queued; the next silence is a new episode
                offlineDeclared = false;
                return;
            }
        }
        log.warn("machine_silent machine={} gen={} silentMs={} windowMs={} -> OFFLINE",
                getMachineId(), generation, silentMs, windowMs);
        MachineStatus offline = MachineStatus.offline(getMachineId());
        if (reconciler.accept(getMachineId(), generation, offline)) {
            lastAccepted = offline;
        }
    }

    // ---- Helpers ----

    private boolean enqueue(Runnable task) {
        try {
            delivery.execute(() -> {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    log.warn("delivery_failed machine={} gen={} err={}", getMachineId(), generation, e.toString());
                }
            });
            return true;
        } catch (RejectedExecutionException e) {
            log.debug("delivery_rejected machine={} gen={} (stopping)", getMachineId(), generation);
            return false;
        }
    }

    private boolean awaitQuiet(ExecutorService executor) {
        try {
            return executor.awaitTermination(Math.max(0, stopAwaitMs), TimeUnit.MILLISECONDS);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private ThreadPoolExecutor newDeliveryQueue() {
        return new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS, new LinkedBlockingQueue<>(), threads("deliver"));
    }

    // machine-<id>-g<generation>-<role>
    private ThreadFactory threads(String role) {
        String name = "machine-" + getMachineId() + "-g" + generation + "-" + role;
        return r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        };
    }

    @Override
    public String toString() {
        return "ProviderHandle[machine=" + getMachineId() + ", gen=" + generation + ", running=" + running + "]";
    }
}
