package com.overseer.monitor.alerts;

import com.overseer.monitor.domain.MachineState;
import com.overseer.monitor.domain.MachineStatus;
import com.overseer.monitor.service.StatusSubscriber;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Keeps a {@code MACHINE_OFFLINE:<id>} alert open while a machine's current state is Offline. */
@Component
@RequiredArgsConstructor
public class OfflineAlertSubscriber implements StatusSubscriber {

    public static final String ALERT_OFFLINE = "MACHINE_OFFLINE";

    private final AlertService alerts;

    @Override
    public void onStatus(MachineStatus status) {
        String key = AlertService.machineKey(ALERT_OFFLINE, status.getMachineId());
        if (status.getState() == MachineState.OFFLINE) {
            alerts.raise(key, "Machine " + status.getMachineId() + " is offline", AlertService.Severity.ERROR);
        } else {
            alerts.resolve(key);
        }
    }
}
