package com.example.summaryscheduler.service.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Daily purge of expired execution results and finished tasks
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RetentionCleanupJob {

    private final TaskSchedulerService schedulerService;

    @Scheduled(cron = "${summary-scheduler.cleanup-cron:0 0 3 * * *}")
    public void purge() {
        if (!schedulerService.isRunning()) {
            log.debug("Scheduler not running, skipping retention cleanup");
            return;
        }

        var result = schedulerService.runCleanup();
        if (result.isSuccess()) {
            log.info("Retention cleanup finished in {}ms: {}", result.getDurationMs(), result.getDetails());
        } else {
            log.error("Retention cleanup failed: {}", result.getErrorMessage());
        }
    }
}
