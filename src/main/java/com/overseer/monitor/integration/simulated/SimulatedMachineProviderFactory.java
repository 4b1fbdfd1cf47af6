package com.overseer.monitor.integration.simulated;

import com.overseer.monitor.domain.MachineRegistration;
import com.overseer.monitor.provider.MachineProvider;
import com.overseer.monitor.provider.MachineProviderFactory;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;

@Component
@RequiredArgsConstructor
public class SimulatedMachineProviderFactory implements MachineProviderFactory {

    public static final String TYPE = "Simulated";

    private final Clock clock;

    @Override
    public String machineType() {
        return TYPE;
    }

    @Override
    public MachineProvider create(MachineRegistration machine) {
        return new SimulatedMachineProvider(clock);
    }
}
