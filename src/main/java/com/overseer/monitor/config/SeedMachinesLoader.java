package com.overseer.monitor.config;

import com.overseer.monitor.service.MachineOrchestrator;
import com.overseer.monitor.service.SyncResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class SeedMachinesLoader {
    private final MonitorProperties properties;
    private final MachineOrchestrator orchestrator;

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        if (properties.getMachines().isEmpty()) {
            log.info("No machines configured under monitor.machines");
            return;
        }
        SyncResult r = orchestrator.sync(properties.toRegistrations());
        if (!r.isClean()) {
            log.warn("Configured machines failed to start: {}", r.getFailed());
        }
    }
}
