package com.example.summaryscheduler.service.scheduler;

import com.example.summaryscheduler.config.MetricsConfig;
import com.example.summaryscheduler.config.SummarySchedulerProperties;
import com.example.summaryscheduler.domain.entity.ScheduledTask;
import com.example.summaryscheduler.domain.entity.TaskExecutionResult;
import com.example.summaryscheduler.domain.enums.ErrorKind;
import com.example.summaryscheduler.domain.enums.ExecutionStatus;
import com.example.summaryscheduler.service.recurrence.RecurrenceCalculator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Applies an execution result to a task's counters and next fire time.
 * <p>
 * Success clears the failure count and moves to the next regular slot.
 * Failure increments the count and retries with exponential backoff until
 * {@code maxFailures} is reached, at which point the task is disabled.
 * Runs that found too little content keep their regular schedule unless
 * configured to count as failures.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FailurePolicy {

    public enum Decision {
        /**
         * Next regular slot
         */
        RESCHEDULED,
        /**
         * Backoff retry after a failure
         */
        RETRY_SCHEDULED,
        /**
         * Failure budget exhausted, task deactivated
         */
        DISABLED,
        /**
         * No further slot, e.g. a one-time task that ran
         */
        COMPLETED
    }

    private static final int MAX_BACKOFF_EXPONENT = 20;

    private final RecurrenceCalculator recurrenceCalculator;
    private final SummarySchedulerProperties properties;
    private final MetricsConfig metricsConfig;

    public Decision apply(ScheduledTask task, TaskExecutionResult result, Instant now) {
        task.setUpdatedAt(now);
        if (result.isSuccess()) {
            return onSuccess(task, now);
        }
        return onFailure(task, result, now);
    }

    /**
     * Clear the failure count, as done by an explicit resume with reset
     */
    public void resetFailures(ScheduledTask task) {
        task.setFailureCount(0);
        task.setLastError(null);
        task.setLastErrorKind(null);
    }

    /**
     * Whether the task's next run is a backoff retry of a counted failure rather than a regular slot
     */
    public boolean isRetryPending(ScheduledTask task) {
        if (task.getLastExecutionStatus() != ExecutionStatus.FAILED || task.getFailureCount() == 0
                || task.hasReachedMaxFailures()) {
            return false;
        }
        return task.getLastErrorKind() != ErrorKind.INSUFFICIENT_CONTENT || properties.isCountInsufficientContentAsFailure();
    }

    /**
     * Delay before the next attempt after {@code failureCount} consecutive failures
     */
    public Duration retryDelay(ScheduledTask task) {
        var exponent = Math.min(Math.max(task.getFailureCount() - 1, 0), MAX_BACKOFF_EXPONENT);
        var delay = Duration.ofMinutes(task.getRetryDelayMinutes()).multipliedBy(1L << exponent);
        var cap = properties.getMaxRetryDelay();
        return delay.compareTo(cap) > 0 ? cap : delay;
    }

    private Decision onSuccess(ScheduledTask task, Instant now) {
        resetFailures(task);
        task.setLastExecutionStatus(ExecutionStatus.COMPLETED);
        return scheduleRegular(task, now);
    }

    private Decision onFailure(ScheduledTask task, TaskExecutionResult result, Instant now) {
        task.setLastError(result.getErrorMessage());
        task.setLastErrorKind(result.getErrorKind());
        task.setLastExecutionStatus(ExecutionStatus.FAILED);
        metricsConfig.recordFailure(result.getErrorKind());

        if (result.isInsufficientContent() && !properties.isCountInsufficientContentAsFailure()) {
            task.setInsufficientContentCount(task.getInsufficientContentCount() + 1);
            log.info("Task {} had insufficient content ({} times), keeping regular schedule",
                    task.getId(), task.getInsufficientContentCount());
            return scheduleRegular(task, now);
        }

        task.setFailureCount(task.getFailureCount() + 1);

        if (task.hasReachedMaxFailures()) {
            task.setActive(false);
            task.setNextRun(null);
            metricsConfig.recordTaskDisabled();
            log.error("Task {} disabled after {} consecutive failures, last error: {}",
                    task.getId(), task.getFailureCount(), result.getErrorMessage());
            return Decision.DISABLED;
        }

        var delay = retryDelay(task);
        task.setNextRun(now.plus(delay));
        metricsConfig.recordRetry(task.getFailureCount());
        log.warn("Task {} failed ({}/{}), retrying at {}: {}",
                task.getId(), task.getFailureCount(), task.getMaxFailures(), task.getNextRun(), result.getErrorMessage());
        return Decision.RETRY_SCHEDULED;
    }

    private Decision scheduleRegular(ScheduledTask task, Instant now) {
        var next = recurrenceCalculator.nextFire(task, now);
        if (next.isEmpty()) {
            task.setActive(false);
            task.setNextRun(null);
            log.info("Task {} has no further runs and is now complete", task.getId());
            return Decision.COMPLETED;
        }
        task.setNextRun(next.get());
        log.debug("Task {} next run at {}", task.getId(), task.getNextRun());
        return Decision.RESCHEDULED;
    }
}
