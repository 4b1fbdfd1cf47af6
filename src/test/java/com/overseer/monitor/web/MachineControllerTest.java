package com.overseer.monitor.web;

import com.overseer.monitor.common.NotFoundException;
import com.overseer.monitor.domain.MachineCommand;
import com.overseer.monitor.domain.MachineRegistration;
import com.overseer.monitor.domain.MachineState;
import com.overseer.monitor.domain.MachineStatus;
import com.overseer.monitor.provider.MachineProviderRegistry;
import com.overseer.monitor.provider.ProviderCommandException;
import com.overseer.monitor.provider.ProviderStartException;
import com.overseer.monitor.service.CommandDispatcher;
import com.overseer.monitor.service.DeviceNotRunningException;
import com.overseer.monitor.service.MachineOrchestrator;
import com.overseer.monitor.service.StateReconciler;
import com.overseer.monitor.service.SyncResult;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = MachineController.class)
class MachineControllerTest {

    @Autowired MockMvc mvc;

    @MockitoBean MachineOrchestrator orchestrator;
    @MockitoBean StateReconciler reconciler;
    @MockitoBean CommandDispatcher dispatcher;
    @MockitoBean MachineProviderRegistry providers;

    @Test
    void machine_types_come_from_the_registry() throws Exception {
        when(providers.machineTypes()).thenReturn(List.of("fake", "simulated"));

        mvc.perform(get("/machines/types"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[1]").value("simulated"));
    }

    @Test
    void command_is_dispatched() throws Exception {
        mvc.perform(post("/machines/2/commands/pause"))
                .andExpect(status().isNoContent());

        verify(dispatcher).dispatch(2, MachineCommand.PAUSE);
    }

    @Test
    void command_for_unmonitored_machine_is_a_conflict() throws Exception {
        doThrow(new DeviceNotRunningException(2, MachineCommand.RESUME)).when(dispatcher).dispatch(2, MachineCommand.RESUME);

        mvc.perform(post("/machines/2/commands/resume"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("DeviceNotRunningException"))
                .andExpect(jsonPath("$.properties.machineId").value(2));
    }

    @Test
    void provider_refusal_is_a_bad_gateway() throws Exception {
        doThrow(new ProviderCommandException("Cannot pause: machine 2 is IDLE"))
                .when(dispatcher).dispatch(2, MachineCommand.PAUSE);

        mvc.perform(post("/machines/2/commands/pause"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.message").value("Cannot pause: machine 2 is IDLE"));
    }

    @Test
    void unknown_command_is_a_bad_request() throws Exception {
        mvc.perform(post("/machines/2/commands/explode"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(dispatcher);
    }

    @Test
    void status_of_machine_without_entry_is_not_found() throws Exception {
        when(reconciler.current(5)).thenReturn(Optional.empty());

        mvc.perform(get("/machines/5/status")).andExpect(status().isNotFound());
    }

    @Test
    void status_of_known_machine_is_returned() throws Exception {
        when(reconciler.current(5)).thenReturn(Optional.of(
                MachineStatus.builder().machineId(5).state(MachineState.PAUSED).progress(0.5).build()));

        mvc.perform(get("/machines/5/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("PAUSED"))
                .andExpect(jsonPath("$.progress").value(0.5));
    }

    @Test
    void register_reads_the_registration_body() throws Exception {
        when(orchestrator.register(any(MachineRegistration.class)))
                .thenReturn(SyncResult.builder().addStarted(9).build());

        mvc.perform(post("/machines")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\":9,\"machineType\":\"Simulated\",\"pollIntervalMs\":500,\"properties\":{\"heaters\":\"1\"}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.started[0]").value(9));

        verify(orchestrator).register(MachineRegistration.builder()
                .id(9).machineType("Simulated").pollIntervalMs(500).properties(Map.of("heaters", "1")).build());
    }

    @Test
    void start_failure_is_a_bad_gateway() throws Exception {
        when(orchestrator.register(any(MachineRegistration.class)))
                .thenThrow(new ProviderStartException(9, "Simulated machine 9 is unreachable"));

        mvc.perform(post("/machines")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\":9,\"machineType\":\"Simulated\"}"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.properties.machineId").value(9));
    }

    @Test
    void invalid_registration_is_a_bad_request() throws Exception {
        mvc.perform(put("/machines")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[{\"id\":1,\"machineType\":\"Simulated\",\"pollIntervalMs\":-5}]"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(orchestrator);
    }

    @Test
    void removing_unknown_machine_is_not_found() throws Exception {
        doThrow(new NotFoundException("Machine 4 is not registered", Map.of("machineId", 4)))
                .when(orchestrator).remove(4);

        mvc.perform(delete("/machines/4"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Machine 4 is not registered"));
    }
}
