package com.overseer.monitor.web;

import com.overseer.monitor.alerts.AlertService;
import com.overseer.monitor.service.MonitorStatusService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class StatusController {

    private final AlertService alerts;

    private final MonitorStatusService status;

    public StatusController(AlertService alerts, MonitorStatusService status) {
        this.alerts = alerts;
        this.status = status;
    }

    @GetMapping("/status")
    public MonitorStatusService.OverviewView getStatus() {
        return status.buildOverview();
    }

    @GetMapping("/alerts")
    public AlertService.AlertsSnapshot getAlerts() {
        return alerts.snapshot();
    }
}
