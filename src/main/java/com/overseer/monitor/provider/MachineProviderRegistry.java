package com.overseer.monitor.provider;

import com.overseer.monitor.domain.MachineRegistration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/** Machine type tag -> provider factory. One factory per tag, tags are case-insensitive. */
@Slf4j
@Component
public class MachineProviderRegistry {

    private final Map<String, MachineProviderFactory> factories = new TreeMap<>();

    public MachineProviderRegistry(List<MachineProviderFactory> contributed) {
        for (MachineProviderFactory f : contributed) {
            String key = normalize(f.machineType());
            MachineProviderFactory previous = factories.putIfAbsent(key, f);
            if (previous != null) {
                throw new IllegalStateException("Two provider factories for machine type '" + f.machineType()
                        + "': " + previous.getClass().getName() + " and " + f.getClass().getName());
            }
        }
        log.info("provider_registry_ready types={}", factories.keySet());
    }

    /** Registered type tags, lower-cased and sorted. */
    public List<String> machineTypes() {
        return List.copyOf(factories.keySet());
    }

    /**
     * @throws ProviderStartException if no factory handles the type, or the factory itself fails
     */
    public MachineProvider create(MachineRegistration machine) {
        MachineProviderFactory f = factories.get(normalize(machine.getMachineType()));
        if (f == null) {
            throw new ProviderStartException(machine.getId(),
                    "No provider registered for machine type '" + machine.getMachineType() + "', known types: " + machineTypes());
        }
        MachineProvider provider;
        try {
            provider = f.create(machine);
        } catch (ProviderStartException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ProviderStartException(machine.getId(),
                    "Provider for '" + machine.getMachineType() + "' could not be created: " + e.getMessage(), e);
        }
        if (provider == null) {
            throw new ProviderStartException(machine.getId(),
                    "Provider for '" + machine.getMachineType() + "' declined machine " + machine.getId());
        }
        return provider;
    }

    private static String normalize(String type) {
        return type == null ? "" : type.trim().toLowerCase(Locale.ROOT);
    }
}
