package com.overseer.monitor.domain;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Value;

import java.util.Map;
import java.util.UUID;

/**
 * Immutable point-in-time status of one machine.
 *
 * The {@code id} identifies this particular emission (tracing, at-most-once delivery to
 * subscribers) and is not part of equality. Temperatures are compared by key/value,
 * heater order as produced by a provider does not matter.
 */
@Value
public class MachineStatus {

    @EqualsAndHashCode.Exclude
    UUID id;
    int machineId;
    MachineState state;
    int elapsedJobTime;           // seconds
    int estimatedTimeRemaining;   // seconds
    double progress;              // 0..1
    Map<Integer, TemperatureStatus> temperatures;

    @Builder(toBuilder = true)
    private MachineStatus(UUID id,
                          int machineId,
                          MachineState state,
                          int elapsedJobTime,
                          int estimatedTimeRemaining,
                          double progress,
                          Map<Integer, TemperatureStatus> temperatures) {
        if (Double.isNaN(progress) || progress < 0.0 || progress > 1.0) {
            throw new IllegalArgumentException("progress must be within [0,1], got " + progress);
        }
        this.id = id != null ? id : UUID.randomUUID();
        this.machineId = machineId;
        this.state = state != null ? state : MachineState.OFFLINE;
        this.elapsedJobTime = Math.max(0, elapsedJobTime);
        this.estimatedTimeRemaining = Math.max(0, estimatedTimeRemaining);
        this.progress = progress;
        this.temperatures = temperatures == null ? Map.of() : Map.copyOf(temperatures);
    }

    /** Status synthesized when a machine stopped reporting. */
    public static MachineStatus offline(int machineId) {
        return MachineStatus.builder().machineId(machineId).state(MachineState.OFFLINE).build();
    }
}
