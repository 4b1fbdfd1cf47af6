package com.overseer.monitor.provider;

import com.overseer.monitor.domain.MachineRegistration;
import com.overseer.monitor.support.FakeProvider;
import com.overseer.monitor.support.FakeProviderFactory;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MachineProviderRegistryTest {

    @Test
    void looks_up_type_case_insensitively() {
        MachineProviderRegistry registry = new MachineProviderRegistry(List.of(new FakeProviderFactory()));

        MachineProvider p = registry.create(machine("FAKE"));

        assertThat(p).isInstanceOf(FakeProvider.class);
        assertThat(registry.machineTypes()).containsExactly("fake");
    }

    @Test
    void unknown_type_is_a_start_failure() {
        MachineProviderRegistry registry = new MachineProviderRegistry(List.of(new FakeProviderFactory()));

        assertThatThrownBy(() -> registry.create(machine("Bambu")))
                .isInstanceOf(ProviderStartException.class)
                .hasMessageContaining("Bambu")
                .hasMessageContaining("known types: [fake]");
    }

    @Test
    void factory_failure_is_a_start_failure() {
        MachineProviderFactory broken = new MachineProviderFactory() {
            @Override public String machineType() { return "Broken"; }
            @Override public MachineProvider create(MachineRegistration machine) {
                throw new IllegalStateException("missing api key");
            }
        };
        MachineProviderRegistry registry = new MachineProviderRegistry(List.of(broken));

        assertThatThrownBy(() -> registry.create(machine("Broken")))
                .isInstanceOf(ProviderStartException.class)
                .hasMessageContaining("missing api key")
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void one_factory_per_type() {
        assertThatThrownBy(() -> new MachineProviderRegistry(List.of(new FakeProviderFactory(), new FakeProviderFactory())))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Fake");
    }

    private static MachineRegistration machine(String type) {
        return MachineRegistration.builder().id(1).machineType(type).build();
    }
}
