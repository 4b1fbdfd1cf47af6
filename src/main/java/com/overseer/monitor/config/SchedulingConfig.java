package com.overseer.monitor.config;

import com.overseer.monitor.alerts.GlobalUncaughtHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;

/**
 * Shared scheduler for the liveness ticker and the summary logger. Device polling never runs
 * here; each provider handle owns its poll thread.
 */
@Slf4j
@Configuration
public class SchedulingConfig {
    private final GlobalUncaughtHandler handler;

    @Value("${monitor.scheduler.threads:2}")
    private int threads;

    public SchedulingConfig(GlobalUncaughtHandler handler) {
        this.handler = handler;
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService scheduler() {
        ScheduledThreadPoolExecutor ex = new ScheduledThreadPoolExecutor(Math.max(2, threads), r -> {
            Thread t = new Thread(r);
            t.setName("monitor-sched-" + t.getId());
            t.setDaemon(true);
            t.setUncaughtExceptionHandler(handler);
            return t;
        });
        ex.setRemoveOnCancelPolicy(true);
        ex.setContinueExistingPeriodicTasksAfterShutdownPolicy(false);
        ex.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        log.info("scheduler_ready threads={}", ex.getCorePoolSize());
        return ex;
    }
}
