package com.overseer.monitor.provider;

import com.overseer.monitor.domain.MachineRegistration;

/**
 * Creates providers for one machine type. Plugins contribute factories as Spring beans;
 * {@link MachineProviderRegistry} indexes them by {@link #machineType()}.
 */
public interface MachineProviderFactory {

    /** Type tag matched against {@link MachineRegistration#getMachineType()}, e.g. "OctoPrint". */
    String machineType();

    MachineProvider create(MachineRegistration machine);
}
