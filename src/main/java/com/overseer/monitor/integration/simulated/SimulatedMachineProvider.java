package com.overseer.monitor.integration.simulated;

import com.overseer.monitor.domain.MachineRegistration;
import com.overseer.monitor.domain.MachineState;
import com.overseer.monitor.domain.MachineStatus;
import com.overseer.monitor.domain.TemperatureStatus;
import com.overseer.monitor.provider.PollingMachineProvider;
import com.overseer.monitor.provider.ProviderCommandException;
import com.overseer.monitor.provider.ProviderStartException;
import com.overseer.monitor.provider.StatusListener;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;

/**
 * Stand-in printer for demos and tests: runs an endless cycle of simulated jobs.
 *
 * Properties:
 *   jobSeconds  (default 600) length of a job in machine time
 *   heaters     (default 2)   heater 0 = bed at 60°C, others = hotends at 210°C
 *   autoStart   (default true) start a new job whenever idle
 *   failStart   (default false) refuse to start, like an unreachable host
 */
@Slf4j
public class SimulatedMachineProvider implements PollingMachineProvider {

    private static final double BED_TARGET = 60.0;
    private static final double HOTEND_TARGET = 210.0;
    private static final double AMBIENT = 22.0;

    private final Clock clock;

    private final Object lock = new Object();
    private int machineId;
    private int jobSeconds;
    private int heaters;
    private boolean autoStart;
    private volatile boolean started;

    // job state, guarded by lock
    private MachineState state = MachineState.IDLE;
    private long elapsedMs;
    private long lastTickMs;

    public SimulatedMachineProvider(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void start(MachineRegistration machine, int intervalMs, StatusListener listener) {
        if (Boolean.parseBoolean(machine.property("failStart", "false"))) {
            throw new ProviderStartException(machine.getId(), "Simulated machine " + machine.getId() + " is unreachable");
        }
        synchronized (lock) {
            machineId = machine.getId();
            jobSeconds = Math.max(1, parseInt(machine.property("jobSeconds", "600"), 600));
            heaters = Math.max(0, parseInt(machine.property("heaters", "2"), 2));
            autoStart = Boolean.parseBoolean(machine.property("autoStart", "true"));
            lastTickMs = clock.millis();
            started = true;
        }
        log.info("sim_started machine={} jobSeconds={} heaters={} autoStart={}", machineId, jobSeconds, heaters, autoStart);
    }

    @Override
    public void stop() {
        started = false;
        log.info("sim_stopped machine={}", machineId);
    }

    @Override
    public MachineStatus poll() {
        if (!started) return null;
        synchronized (lock) {
            advance();
            long jobMs = jobSeconds * 1000L;
            boolean inJob = state == MachineState.OPERATIONAL || state == MachineState.PAUSED;
            double progress = inJob ? Math.min(1.0, (double) elapsedMs / jobMs) : 0.0;
            return MachineStatus.builder()
                    .machineId(machineId)
                    .state(state)
                    .elapsedJobTime(inJob ? (int) (elapsedMs / 1000) : 0)
                    .estimatedTimeRemaining(inJob ? (int) ((jobMs - elapsedMs) / 1000) : 0)
                    .progress(progress)
                    .temperatures(temperatures(inJob))
                    .build();
        }
    }

    @Override
    public void pauseJob() {
        synchronized (lock) {
            advance();
            if (state != MachineState.OPERATIONAL) {
                throw new ProviderCommandException("Cannot pause: machine " + machineId + " is " + state,
                        Map.of("machineId", machineId, "state", state));
            }
            state = MachineState.PAUSED;
        }
        log.info("sim_paused machine={}", machineId);
    }

    @Override
    public void resumeJob() {
        synchronized (lock) {
            advance();
            if (state != MachineState.PAUSED) {
                throw new ProviderCommandException("Cannot resume: machine " + machineId + " is " + state,
                        Map.of("machineId", machineId, "state", state));
            }
            state = MachineState.OPERATIONAL;
        }
        log.info("sim_resumed machine={}", machineId);
    }

    @Override
    public void cancelJob() {
        synchronized (lock) {
            advance();
            if (state == MachineState.IDLE) {
                throw new ProviderCommandException("Cannot cancel: machine " + machineId + " has no job",
                        Map.of("machineId", machineId, "state", state));
            }
            state = MachineState.IDLE;
            elapsedMs = 0;
            autoStart = false; // a cancelled machine waits for the operator
        }
        log.info("sim_cancelled machine={}", machineId);
    }

    // must hold lock
    private void advance() {
        long now = clock.millis();
        long dt = Math.max(0, now - lastTickMs);
        lastTickMs = now;
        switch (state) {
            case IDLE -> {
                if (autoStart) {
                    state = MachineState.OPERATIONAL;
                    elapsedMs = 0;
                }
            }
            case OPERATIONAL -> {
                elapsedMs += dt;
                if (elapsedMs >= jobSeconds * 1000L) {
                    state = MachineState.IDLE;
                    elapsedMs = 0;
                }
            }
            default -> { /* paused/offline: clock does not run */ }
        }
    }

    private Map<Integer, TemperatureStatus> temperatures(boolean heating) {
        Map<Integer, TemperatureStatus> out = new HashMap<>();
        for (int i = 0; i < heaters; i++) {
            double target = heating ? (i == 0 ? BED_TARGET : HOTEND_TARGET) : 0.0;
            double actual = heating ? target : AMBIENT;
            out.put(i, new TemperatureStatus(i, actual, target));
        }
        return out;
    }

    private static int parseInt(String raw, int fallback) {
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}
