package com.overseer.monitor.config;

import com.overseer.monitor.domain.MachineRegistration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Machines declared in configuration ({@code monitor.machines[*]}), synced once at startup. */
@Data
@Component
@ConfigurationProperties(prefix = "monitor")
public class MonitorProperties {

    private List<Machine> machines = new ArrayList<>();

    @Data
    public static class Machine {
        private int id;
        private String name;
        private String type;
        private boolean disabled;
        private int pollIntervalMs = MachineRegistration.DEFAULT_POLL_INTERVAL_MS;
        private Map<String, String> properties = new LinkedHashMap<>();

        MachineRegistration toRegistration() {
            return MachineRegistration.builder()
                    .id(id)
                    .name(name)
                    .machineType(type)
                    .disabled(disabled)
                    .pollIntervalMs(pollIntervalMs)
                    .properties(properties)
                    .build();
        }
    }

    public List<MachineRegistration> toRegistrations() {
        return machines.stream().map(Machine::toRegistration).toList();
    }
}
