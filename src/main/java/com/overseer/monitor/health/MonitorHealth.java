package com.overseer.monitor.health;

import com.overseer.monitor.service.MonitorStatusService;
import org.springframework.boot.actuate.health.*;
import org.springframework.stereotype.Component;

@Component
public class MonitorHealth implements HealthIndicator {
    private final MonitorStatusService status;

    public MonitorHealth(MonitorStatusService status) { this.status = status; }

    // Offline machines are a fact about the devices, not about this service; unmonitored ones are not.
    @Override public Health health() {
        var v = status.buildOverview();
        boolean ok = v.getUnmonitored() == 0;

        return (ok ? Health.up() : Health.down())
                .withDetail("registered", v.getRegistered())
                .withDetail("running", v.getRunning())
                .withDetail("offline", v.getOffline())
                .withDetail("unmonitored", v.getUnmonitored())
                .build();
    }
}
