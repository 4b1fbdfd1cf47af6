package com.overseer.monitor.alerts;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Last line for exceptions that escape a thread (scheduler workers, per-machine
 * delivery threads, provider-owned threads). Turns them into CRITICAL alerts.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GlobalUncaughtHandler implements Thread.UncaughtExceptionHandler {

    private final AlertService alerts;

    private volatile boolean stopping = false; // mute noise while shutting down

    @PostConstruct
    void registerAsDefault() {
        Thread.setDefaultUncaughtExceptionHandler(this);
        log.info("Global uncaught handler installed");
    }

    @EventListener
    public void onContextClosed(ContextClosedEvent e) {
        stopping = true;
    }

    @Override
    public void uncaughtException(Thread t, Throwable e) {
        if (stopping) return;

        String key = classify(t);
        log.error("Uncaught in {} -> {}", t.getName(), e.toString(), e);
        alerts.raise(key, t.getName() + ": " + e, AlertService.Severity.CRITICAL);
    }

    /** Per-machine threads are named {@code machine-<id>-g<generation>-<role>}. */
    static String classify(Thread t) {
        String name = (t.getName() == null ? "" : t.getName());
        if (name.startsWith("machine-")) {
            String rest = name.substring("machine-".length());
            int dash = rest.indexOf('-');
            String id = dash > 0 ? rest.substring(0, dash) : rest;
            return "PROVIDER_UNCAUGHT:" + id;
        }
        return "UNCAUGHT";
    }
}
