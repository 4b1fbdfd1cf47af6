package com.overseer.monitor.service;

import com.overseer.monitor.domain.MachineStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Owner of the current-state table (machine id -> last accepted status).
 *
 * <p>Each machine has a slot guarded by its own monitor: writes for one machine are
 * serialized, writes for different machines never wait on each other. A slot is opened
 * for a handle generation by {@link #activate} and closed by {@link #retire}; statuses
 * from an older generation, or arriving while the slot is closed, are dropped.</p>
 *
 * <p>Within a generation the last accepted status wins. Subscribers see each status id
 * at most once.</p>
 */
@Slf4j
@Component
public class StateReconciler {

    /** How many recent status ids per machine are remembered for subscriber de-duplication. */
    static final int DELIVERED_WINDOW = 32;

    private final Map<Integer, Slot> slots = new ConcurrentHashMap<>();
    private final List<StatusSubscriber> subscribers = new CopyOnWriteArrayList<>();

    public void registerSubscriber(StatusSubscriber subscriber) {
        subscribers.add(subscriber);
    }

    /** Open the machine's slot for {@code generation}. Older generations than the current one are ignored. */
    public void activate(int machineId, long generation) {
        Slot slot = slots.computeIfAbsent(machineId, Slot::new);
        synchronized (slot) {
            if (generation < slot.generation) {
                log.warn("activate_ignored machine={} gen={} current={}", machineId, generation, slot.generation);
                return;
            }
            slot.generation = generation;
            slot.active = true;
        }
        log.debug("slot_activated machine={} gen={}", machineId, generation);
    }

    /**
     * Merge one status into the table.
     *
     * @return true if the status became the machine's current entry
     */
    public boolean accept(int machineId, long generation, MachineStatus status) {
        Slot slot = slots.get(machineId);
        if (slot == null) {
            log.debug("status_dropped machine={} gen={} id={} reason=no_slot", machineId, generation, status.getId());
            return false;
        }
        synchronized (slot) {
            if (!slot.active) {
                log.debug("status_dropped machine={} gen={} id={} reason=retired", machineId, generation, status.getId());
                return false;
            }
            if (generation < slot.generation) {
                log.debug("status_dropped machine={} gen={} current={} id={} reason=stale_generation",
                        machineId, generation, slot.generation, status.getId());
                return false;
            }
            slot.generation = generation;
            slot.current = status;
            if (slot.firstDelivery(status.getId())) {
                notifySubscribers(status);
            } else if (log.isTraceEnabled()) {
                log.trace("status_redelivered machine={} id={}", machineId, status.getId());
            }
            return true;
        }
    }

    /** Close the slot if it still belongs to {@code generation}; the last known status stays visible. */
    public void retire(int machineId, long generation) {
        Slot slot = slots.get(machineId);
        if (slot == null) return;
        synchronized (slot) {
            if (slot.generation == generation) {
                slot.active = false;
                log.debug("slot_retired machine={} gen={}", machineId, generation);
            }
        }
    }

    /** Forget the machine entirely (registration deleted). */
    public void evict(int machineId) {
        Slot slot = slots.get(machineId);
        if (slot == null) return;
        synchronized (slot) {
            slot.active = false;
            slots.remove(machineId, slot);
        }
        log.debug("slot_evicted machine={}", machineId);
    }

    public Optional<MachineStatus> current(int machineId) {
        Slot slot = slots.get(machineId);
        return slot == null ? Optional.empty() : Optional.ofNullable(slot.current);
    }

    /** Copy of the table, ordered by machine id. */
    public Map<Integer, MachineStatus> snapshot() {
        Map<Integer, MachineStatus> out = new TreeMap<>();
        slots.forEach((id, slot) -> {
            MachineStatus s = slot.current;
            if (s != null) out.put(id, s);
        });
        return Collections.unmodifiableMap(out);
    }

    private void notifySubscribers(MachineStatus status) {
        for (StatusSubscriber s : subscribers) {
            try {
                s.onStatus(status);
            } catch (RuntimeException e) {
                log.warn("subscriber_failed subscriber={} machine={} err={}",
                        s.getClass().getSimpleName(), status.getMachineId(), e.toString());
            }
        }
    }

    private static final class Slot {
        final int machineId;
        long generation = Long.MIN_VALUE;
        boolean active;
        volatile MachineStatus current;
        private final Deque<UUID> delivered = new ArrayDeque<>();

        Slot(int machineId) {
            this.machineId = machineId;
        }

        /** Remember {@code id}; false if it was seen recently. */
        boolean firstDelivery(UUID id) {
            if (delivered.contains(id)) return false;
            delivered.addLast(id);
            while (delivered.size() > DELIVERED_WINDOW) delivered.removeFirst();
            return true;
        }
    }
}
