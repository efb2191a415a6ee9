package com.example.summaryscheduler.service.scheduler;

import com.example.summaryscheduler.config.SummarySchedulerProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Starts the scheduler once the application context is ready and stops it
 * before the worker pools shut down.
 */
@Component
@RequiredArgsConstructor
public class SchedulerLifecycle implements SmartLifecycle {

    private final TaskSchedulerService schedulerService;
    private final SummarySchedulerProperties properties;

    @Override
    public void start() {
        schedulerService.start();
    }

    @Override
    public void stop() {
        schedulerService.stop();
    }

    @Override
    public boolean isRunning() {
        return schedulerService.isRunning();
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return properties.isAutoStartup();
    }
}
