package com.overseer.monitor.alerts;

import com.overseer.monitor.service.StateReconciler;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;

@Configuration
@RequiredArgsConstructor
public class AlertSubscribersConfig {
    private final StateReconciler reconciler;
    private final OfflineAlertSubscriber offlineAlerts;

    @PostConstruct
    void init() {
        reconciler.registerSubscriber(offlineAlerts);
    }
}
