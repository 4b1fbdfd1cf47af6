package com.overseer.monitor.service;

import com.overseer.monitor.alerts.AlertService;
import com.overseer.monitor.common.NotFoundException;
import com.overseer.monitor.domain.MachineRegistration;
import com.overseer.monitor.provider.MachineProviderRegistry;
import com.overseer.monitor.provider.ProviderStartException;
import jakarta.annotation.PreDestroy;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Keeps the running provider handles in line with the machine registrations.
 *
 * <ul>
 *   <li>new or re-enabled machine -> new handle, new generation</li>
 *   <li>disabled machine -> handle stopped, last known status kept in the table</li>
 *   <li>deleted machine -> handle stopped, status evicted</li>
 *   <li>type, interval or properties changed -> stop, then start under a new generation</li>
 * </ul>
 *
 * All mutations are serialized on one lock; queries read concurrent maps and never block.
 */
@Slf4j
@Service
public class MachineOrchestrator {

    public static final String ALERT_START_FAILED = "PROVIDER_START_FAILED";

    private final MachineProviderRegistry registry;
    private final StateReconciler reconciler;
    private final Clock clock;
    private final AlertService alerts;

    @Getter @Setter
    @Value("${monitor.stop.awaitMs:5000}")
    private long stopAwaitMs = 5000;

    private final Object syncLock = new Object();
    private final Map<Integer, MachineRegistration> registrations = new ConcurrentHashMap<>();
    private final Map<Integer, ProviderHandle> handles = new ConcurrentHashMap<>();
    private final AtomicLong generations = new AtomicLong();

    public MachineOrchestrator(MachineProviderRegistry registry,
                               StateReconciler reconciler,
                               Clock clock,
                               AlertService alerts) {
        this.registry = registry;
        this.reconciler = reconciler;
        this.clock = clock;
        this.alerts = alerts;
    }

    // ---------------------- Mutations ----------------------

    /**
     * Bring the running set in line with {@code desired}, the complete list of configured
     * machines. A machine that fails to start does not stop the pass; it is reported in
     * {@link SyncResult#getFailed()} and stays unmonitored.
     */
    public SyncResult sync(Collection<MachineRegistration> desired) {
        Map<Integer, MachineRegistration> byId = new LinkedHashMap<>();
        for (MachineRegistration r : desired) {
            if (byId.putIfAbsent(r.getId(), r) != null) {
                throw new IllegalArgumentException("Machine id " + r.getId() + " appears more than once");
            }
        }

        synchronized (syncLock) {
            SyncResult.SyncResultBuilder result = SyncResult.builder();
            for (Integer id : new ArrayList<>(registrations.keySet())) {
                if (!byId.containsKey(id)) {
                    removeLocked(id);
                    result.addRemoved(id);
                }
            }
            for (MachineRegistration r : byId.values()) {
                try {
                    applyLocked(r, result);
                } catch (ProviderStartException e) {
                    result.addFailed(r.getId(), e.getMessage());
                }
            }
            SyncResult out = result.build();
            log.info("sync_done started={} restarted={} stopped={} removed={} unchanged={} failed={}",
                    out.getStarted(), out.getRestarted(), out.getStopped(), out.getRemoved(),
                    out.getUnchanged(), out.getFailed().keySet());
            return out;
        }
    }

    /**
     * Add or update one machine.
     *
     * @throws ProviderStartException if the machine is enabled and its provider fails to start;
     *                                the registration is kept so it can be retried
     */
    public SyncResult register(MachineRegistration registration) {
        synchronized (syncLock) {
            SyncResult.SyncResultBuilder result = SyncResult.builder();
            applyLocked(registration, result);
            return result.build();
        }
    }

    public SyncResult enable(int machineId) {
        synchronized (syncLock) {
            return register(require(machineId).toBuilder().disabled(false).build());
        }
    }

    public SyncResult disable(int machineId) {
        synchronized (syncLock) {
            return register(require(machineId).toBuilder().disabled(true).build());
        }
    }

    public void remove(int machineId) {
        synchronized (syncLock) {
            require(machineId);
            removeLocked(machineId);
        }
    }

    @PreDestroy
    public void shutdown() {
        synchronized (syncLock) {
            log.info("orchestrator_shutdown handles={}", handles.size());
            for (ProviderHandle h : handles.values()) {
                stopQuietly(h);
            }
            handles.clear();
        }
    }

    // ---------------------- Queries ----------------------

    public Optional<ProviderHandle> runningHandle(int machineId) {
        ProviderHandle h = handles.get(machineId);
        return (h != null && h.isRunning()) ? Optional.of(h) : Optional.empty();
    }

    public List<ProviderHandle> runningHandles() {
        List<ProviderHandle> out = new ArrayList<>(handles.size());
        for (ProviderHandle h : handles.values()) {
            if (h.isRunning()) out.add(h);
        }
        return out;
    }

    public boolean isRunning(int machineId) {
        return runningHandle(machineId).isPresent();
    }

    public Optional<MachineRegistration> registration(int machineId) {
        return Optional.ofNullable(registrations.get(machineId));
    }

    public List<MachineRegistration> registrations() {
        return registrations.values().stream()
                .sorted(Comparator.comparingInt(MachineRegistration::getId))
                .toList();
    }

    // ---------------------- internals ----------------------

    private void applyLocked(MachineRegistration r, SyncResult.SyncResultBuilder result) {
        int id = r.getId();
        registrations.put(id, r);
        ProviderHandle current = handles.get(id);

        if (r.isDisabled()) {
            if (current != null) {
                handles.remove(id);
                stopQuietly(current);
                result.addStopped(id);
            } else {
                result.addUnchanged(id);
            }
            alerts.resolve(AlertService.machineKey(ALERT_START_FAILED, id));
            return;
        }

        if (current != null && !r.requiresRestartFrom(current.getMachine())) {
            result.addUnchanged(id);
            return;
        }

        if (current != null) {
            handles.remove(id);
            stopQuietly(current);
        }
        startLocked(r);
        if (current != null) result.addRestarted(id);
        else result.addStarted(id);
    }

    private void startLocked(MachineRegistration r) {
        long gen = generations.incrementAndGet();
        ProviderHandle h = new ProviderHandle(r, gen, registry, reconciler, clock, stopAwaitMs);
        String alertKey = AlertService.machineKey(ALERT_START_FAILED, r.getId());
        try {
            h.start();
        } catch (ProviderStartException e) {
            log.warn("provider_start_failed machine={} type={} gen={} err={}",
                    r.getId(), r.getMachineType(), gen, e.getMessage());
            alerts.raise(alertKey, e.getMessage(), AlertService.Severity.ERROR);
            throw e;
        }
        handles.put(r.getId(), h);
        alerts.resolve(alertKey);
    }

    private void removeLocked(int machineId) {
        registrations.remove(machineId);
        ProviderHandle h = handles.remove(machineId);
        if (h != null) stopQuietly(h);
        reconciler.evict(machineId);
        alerts.resolveMachine(machineId);
        log.info("machine_removed machine={}", machineId);
    }

    private void stopQuietly(ProviderHandle h) {
        try {
            h.stop();
        } catch (RuntimeException e) {
            log.warn("handle_stop_failed machine={} gen={} err={}", h.getMachineId(), h.getGeneration(), e.toString());
        }
    }

    private MachineRegistration require(int machineId) {
        MachineRegistration r = registrations.get(machineId);
        if (r == null) {
            throw new NotFoundException("Machine " + machineId + " is not registered", Map.of("machineId", machineId));
        }
        return r;
    }
}
