package com.overseer.monitor.service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Declares machines Offline when their provider goes quiet.
 *
 * One ticker scans every running handle. A machine is silent once nothing arrived for
 * longer than {@code pollIntervalMs * multiplier}; the handle then queues a synthesized
 * Offline status through its normal delivery path. Stopped handles are never scanned,
 * so a deliberately stopped machine is not reported Offline.
 */
@Slf4j
@Component
@Getter @Setter
public class LivenessMonitor {

    @Value("${monitor.liveness.multiplier:2}")        private int multiplier;
    @Value("${monitor.liveness.scanIntervalMs:100}")  private long scanIntervalMs;

    private final ScheduledExecutorService scheduler;
    private final MachineOrchestrator orchestrator;
    private volatile ScheduledFuture<?> ticker;

    public LivenessMonitor(ScheduledExecutorService scheduler, MachineOrchestrator orchestrator) {
        this.scheduler = scheduler;
        this.orchestrator = orchestrator;
    }

    @PostConstruct
    public void startTicker() {
        long period = Math.max(10L, scanIntervalMs);
        ticker = scheduler.scheduleAtFixedRate(this::scanSafe, period, period, TimeUnit.MILLISECONDS);
        log.info("liveness_ticker_started periodMs={} multiplier={}", period, multiplier);
    }

    @PreDestroy
    public void stopTicker() {
        ScheduledFuture<?> t = ticker;
        if (t != null) t.cancel(false);
    }

    /** Liveness window for one machine. */
    public long windowMs(ProviderHandle handle) {
        return (long) handle.getMachine().getPollIntervalMs() * Math.max(1, multiplier);
    }

    /**
     * One pass over all running handles.
     *
     * @return how many machines were newly declared silent in this pass
     */
    public int scan() {
        int declared = 0;
        for (ProviderHandle h : orchestrator.runningHandles()) {
            try {
                if (h.checkLiveness(windowMs(h))) declared++;
            } catch (RuntimeException e) {
                log.warn("liveness_check_failed machine={} gen={} err={}", h.getMachineId(), h.getGeneration(), e.toString());
            }
        }
        return declared;
    }

    private void scanSafe() {
        try {
            scan();
        } catch (Exception e) {
            // a periodic task that throws is never rescheduled
            log.warn("liveness_scan_failed: {}", e.toString());
        }
    }
}
