package com.overseer.monitor.service;

import com.overseer.monitor.domain.MachineCommand;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Routes job commands to the machine's running handle.
 *
 * No state checks happen here (pausing an idle machine is the provider's call) and
 * provider failures are passed through as thrown, without retry.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CommandDispatcher {

    private final MachineOrchestrator orchestrator;

    /**
     * @throws DeviceNotRunningException if the machine has no running handle
     */
    public void dispatch(int machineId, MachineCommand command) {
        ProviderHandle handle = orchestrator.runningHandle(machineId)
                .orElseThrow(() -> new DeviceNotRunningException(machineId, command));
        log.info("command_dispatch machine={} gen={} cmd={}", machineId, handle.getGeneration(), command);
        try {
            handle.execute(command);
        } catch (RuntimeException e) {
            log.warn("command_failed machine={} gen={} cmd={} err={}", machineId, handle.getGeneration(), command, e.toString());
            throw e;
        }
    }
}
