package com.overseer.monitor.alerts;

import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Open problems keyed by a string such as {@code MACHINE_OFFLINE:3}.
 *
 * A key is active from its first {@link #raise} until {@link #resolve}; raising it again
 * after that opens a new episode. Every transition is also kept in a short event log.
 */
@Slf4j
@Service
public class AlertService {

    public enum Severity { INFO, WARN, ERROR, CRITICAL }

    @Value @Builder
    public static class AlertView {
        String key;
        String message;
        Severity severity;
        long since;       // epoch ms, start of the episode
        long lastSeen;    // epoch ms, latest raise
        int count;        // raises in this episode
    }

    @Value @Builder
    public static class AlertEvent {
        String key;
        String message;
        Severity severity;
        long ts;          // epoch ms
        boolean raised;   // false = resolved
    }

    @Value @Builder
    public static class AlertsSnapshot {
        List<AlertView> active;   // most recently raised first
        List<AlertEvent> recent;  // newest first
    }

    private static final int EVENT_CAPACITY = 50;

    private final Clock clock;
    private final Map<String, AlertView> active = new ConcurrentHashMap<>();
    private final Deque<AlertEvent> events = new ArrayDeque<>();

    public AlertService(Clock clock) {
        this.clock = clock;
    }

    /** Key for a per-machine alert, e.g. {@code MACHINE_OFFLINE:3}. */
    public static String machineKey(String kind, int machineId) {
        return kind + ":" + machineId;
    }

    /** Open the alert, or refresh it if already open. */
    public void raise(String key, String message, Severity severity) {
        long now = clock.millis();
        AlertView updated = active.compute(key, (k, open) -> open == null
                ? AlertView.builder().key(k).message(message).severity(severity).since(now).lastSeen(now).count(1).build()
                : AlertView.builder().key(k).message(message).severity(severity).since(open.getSince()).lastSeen(now)
                        .count(open.getCount() + 1).build());

        if (updated.getCount() == 1) {
            log.warn("alert_raised key={} sev={} msg={}", key, severity, message);
            record(key, message, severity, now, true);
        } else {
            log.debug("alert_refreshed key={} count={}", key, updated.getCount());
        }
    }

    /** Close the alert. No-op if it is not open. */
    public void resolve(String key) {
        AlertView closed = active.remove(key);
        if (closed == null) return;
        log.info("alert_resolved key={} openMs={}", key, clock.millis() - closed.getSince());
        record(key, "recovered", closed.getSeverity(), clock.millis(), false);
    }

    /** Close every alert of one machine (used when the machine is deleted). */
    public void resolveMachine(int machineId) {
        String suffix = ":" + machineId;
        active.keySet().stream()
                .filter(k -> k.endsWith(suffix))
                .toList()
                .forEach(this::resolve);
    }

    public boolean isActive(String key) {
        return active.containsKey(key);
    }

    public AlertsSnapshot snapshot() {
        List<AlertView> open = active.values().stream()
                .sorted(Comparator.comparingLong(AlertView::getLastSeen).reversed())
                .toList();
        List<AlertEvent> recent;
        synchronized (events) {
            recent = new ArrayList<>(events);
        }
        Collections.reverse(recent);
        return AlertsSnapshot.builder().active(open).recent(recent).build();
    }

    private void record(String key, String message, Severity severity, long ts, boolean raised) {
        AlertEvent e = AlertEvent.builder().key(key).message(message).severity(severity).ts(ts).raised(raised).build();
        synchronized (events) {
            events.addLast(e);
            while (events.size() > EVENT_CAPACITY) events.removeFirst();
        }
    }
}
