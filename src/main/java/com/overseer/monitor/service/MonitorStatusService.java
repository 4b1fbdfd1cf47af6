package com.overseer.monitor.service;

import com.overseer.monitor.domain.MachineRegistration;
import com.overseer.monitor.domain.MachineState;
import com.overseer.monitor.domain.MachineStatus;
import jakarta.annotation.PostConstruct;
import lombok.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Overview of every registered machine for the UI, the health indicator and the
 * periodic summary log.
 */
@Slf4j
@Component
public class MonitorStatusService {

    private final ScheduledExecutorService scheduler;
    private final MachineOrchestrator orchestrator;
    private final StateReconciler reconciler;
    private final Clock clock;

    @Value("${monitor.summary.periodSec:30}")
    private int summaryEverySec;

    public MonitorStatusService(ScheduledExecutorService scheduler,
                                MachineOrchestrator orchestrator,
                                StateReconciler reconciler,
                                Clock clock) {
        this.scheduler = scheduler;
        this.orchestrator = orchestrator;
        this.reconciler = reconciler;
        this.clock = clock;
    }

    @PostConstruct
    void startSummaryLogger() {
        int period = Math.max(1, summaryEverySec);
        scheduler.scheduleAtFixedRate(this::logSummarySafe, period, period, TimeUnit.SECONDS);
        log.info("Status summary logger started: every {}s", period);
    }

    // ---------------------- Public API ----------------------

    public OverviewView buildOverview() {
        long now = clock.millis();
        List<MachineRow> rows = new ArrayList<>();
        int running = 0, offline = 0, unmonitored = 0;

        for (MachineRegistration r : orchestrator.registrations()) {
            Optional<ProviderHandle> h = orchestrator.runningHandle(r.getId());
            MachineStatus s = reconciler.current(r.getId()).orElse(null);
            long ageMs = h.map(x -> Math.max(0, now - x.getLastSeenMs())).orElse(-1L);

            if (h.isPresent()) running++;
            else if (r.isEnabled()) unmonitored++;
            if (h.isPresent() && s != null && s.getState() == MachineState.OFFLINE) offline++;

            rows.add(MachineRow.builder()
                    .id(r.getId())
                    .name(r.getName())
                    .machineType(r.getMachineType())
                    .enabled(r.isEnabled())
                    .running(h.isPresent())
                    .generation(h.map(ProviderHandle::getGeneration).orElse(0L))
                    .state(s == null ? "-" : s.getState().name())
                    .progressPct(s == null ? 0.0 : round1(s.getProgress() * 100.0))
                    .lastSeenAgeMs(ageMs)
                    .lastSeenHuman(humanAge(ageMs))
                    .build());
        }

        return OverviewView.builder()
                .registered(rows.size())
                .running(running)
                .offline(offline)
                .unmonitored(unmonitored)
                .machines(rows)
                .build();
    }

    // ---------------------- Log summary ----------------------

    private void logSummarySafe() {
        try {
            OverviewView v = buildOverview();
            log.info("Status: registered={} running={} offline={} unmonitored={}",
                    v.registered, v.running, v.offline, v.unmonitored);
            if (log.isDebugEnabled()) {
                for (MachineRow m : v.machines) {
                    log.debug("  machine={} ({}) state={} progress={}% gen={} seen {}",
                            m.id, m.machineType, m.state, m.progressPct, m.generation, m.lastSeenHuman);
                }
            }
        } catch (Exception e) {
            log.warn("status_summary_failed: {}", e.getMessage());
        }
    }

    // ---------------------- formatting helpers ----------------------

    static String humanAge(long ageMs) {
        if (ageMs < 0) return "-";
        if (ageMs < 1000) return ageMs + " ms";
        long s = ageMs / 1000;
        if (s < 60) return s + " s";
        long m = s / 60;
        long remS = s % 60;
        return m + " min " + remS + " s";
    }

    private static double round1(double v) { return Math.round(v * 10.0) / 10.0; }

    @Builder @Getter @ToString @EqualsAndHashCode @AllArgsConstructor
    public static class MachineRow {
        int     id;
        String  name;
        String  machineType;
        boolean enabled;
        boolean running;
        long    generation;
        String  state;
        double  progressPct;
        long    lastSeenAgeMs;
        String  lastSeenHuman;
    }

    @Builder @Getter @ToString @EqualsAndHashCode @AllArgsConstructor
    public static class OverviewView {
        int registered;
        int running;
        int offline;       // running but currently Offline
        int unmonitored;   // enabled but no running handle (start failed)
        List<MachineRow> machines;
    }
}
