package com.overseer.monitor.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;
import java.util.Objects;

/**
 * A configured machine as the orchestrator sees it.
 *
 * {@code properties} is provider-specific configuration (host, api key, serial, ...);
 * it is handed to the provider as-is.
 */
@Value
public class MachineRegistration {

    public static final int DEFAULT_POLL_INTERVAL_MS = 1000;

    int id;
    String name;
    String machineType;
    boolean disabled;
    int pollIntervalMs;
    Map<String, String> properties;

    @Jacksonized
    @Builder(toBuilder = true)
    private MachineRegistration(int id,
                                String name,
                                String machineType,
                                boolean disabled,
                                int pollIntervalMs,
                                Map<String, String> properties) {
        if (machineType == null || machineType.isBlank()) {
            throw new IllegalArgumentException("machineType is required for machine " + id);
        }
        if (pollIntervalMs < 0) {
            throw new IllegalArgumentException("pollIntervalMs must not be negative for machine " + id);
        }
        this.id = id;
        this.name = (name == null || name.isBlank()) ? machineType + "-" + id : name;
        this.machineType = machineType.trim();
        this.disabled = disabled;
        this.pollIntervalMs = pollIntervalMs == 0 ? DEFAULT_POLL_INTERVAL_MS : pollIntervalMs;
        this.properties = properties == null ? Map.of() : Map.copyOf(properties);
    }

    @JsonIgnore
    public boolean isEnabled() {
        return !disabled;
    }

    /** True when a running monitor for {@code running} cannot simply keep going under this registration. */
    public boolean requiresRestartFrom(MachineRegistration running) {
        return running == null
                || !machineType.equals(running.machineType)
                || pollIntervalMs != running.pollIntervalMs
                || !Objects.equals(properties, running.properties);
    }

    public String property(String key, String fallback) {
        String v = properties.get(key);
        return (v == null || v.isBlank()) ? fallback : v;
    }
}
