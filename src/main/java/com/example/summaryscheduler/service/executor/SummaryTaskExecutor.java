package com.example.summaryscheduler.service.executor;

import com.example.summaryscheduler.config.MetricsConfig;
import com.example.summaryscheduler.config.SummarySchedulerProperties;
import com.example.summaryscheduler.domain.entity.CleanupTask;
import com.example.summaryscheduler.domain.entity.ContentItem;
import com.example.summaryscheduler.domain.entity.DeliveryOutcome;
import com.example.summaryscheduler.domain.entity.Destination;
import com.example.summaryscheduler.domain.entity.ScheduledTask;
import com.example.summaryscheduler.domain.entity.SummaryArtifact;
import com.example.summaryscheduler.domain.entity.TaskExecutionResult;
import com.example.summaryscheduler.domain.enums.ErrorKind;
import com.example.summaryscheduler.domain.repository.TaskStore;
import com.example.summaryscheduler.exception.ContentAccessException;
import com.example.summaryscheduler.service.collaborator.ArtifactProducer;
import com.example.summaryscheduler.service.collaborator.ContentSource;
import com.example.summaryscheduler.service.collaborator.ProductionResult;
import com.example.summaryscheduler.service.delivery.DeliverySinkRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one summary task to completion.
 * <p>
 * Flow:
 * 1. Mark the task running and persist the marker
 * 2. Fetch content for the task's window, bounded by a deadline
 * 3. Produce the artifact, bounded by a deadline
 * 4. Deliver to every enabled destination, each in isolation
 * <p>
 * A run succeeds once the artifact exists; delivery failures are reported per
 * destination. The executor never touches failure counters or next run times,
 * that is left to the failure policy.
 */
@Slf4j
@Service
public class SummaryTaskExecutor {

    private final ContentSource contentSource;
    private final ArtifactProducer artifactProducer;
    private final DeliverySinkRegistry sinkRegistry;
    private final TaskStore taskStore;
    private final MetricsConfig metricsConfig;
    private final SummarySchedulerProperties properties;
    private final AsyncTaskExecutor collaboratorExecutor;
    private final Clock clock;

    public SummaryTaskExecutor(ContentSource contentSource, ArtifactProducer artifactProducer, DeliverySinkRegistry sinkRegistry,
                               TaskStore taskStore, MetricsConfig metricsConfig, SummarySchedulerProperties properties,
                               @Qualifier("collaboratorExecutor") AsyncTaskExecutor collaboratorExecutor, Clock clock) {
        this.contentSource = contentSource;
        this.artifactProducer = artifactProducer;
        this.sinkRegistry = sinkRegistry;
        this.taskStore = taskStore;
        this.metricsConfig = metricsConfig;
        this.properties = properties;
        this.collaboratorExecutor = collaboratorExecutor;
        this.clock = clock;
    }

    /**
     * Execute a task with the configured per-phase timeouts
     */
    public TaskExecutionResult run(ScheduledTask task) {
        return run(task, null);
    }

    /**
     * Execute a task, giving up on fetch or production once {@code deadline} passes
     *
     * @param task     The task to execute
     * @param deadline Overall deadline, null for per-phase timeouts only
     * @return the execution result, never null
     */
    public TaskExecutionResult run(ScheduledTask task, Instant deadline) {
        var taskId = task.getId();
        var timerSample = metricsConfig.startExecutionTimer();
        var startedAt = clock.instant();

        log.info("Starting execution of task {} ({}) for source {}", taskId, task.getName(), task.getSourceRef());

        TaskExecutionResult result;
        try {
            validate(task);
        } catch (IllegalArgumentException e) {
            log.error("Task {} validation failed: {}", taskId, e.getMessage());
            result = TaskExecutionResult.failure(taskId, ErrorKind.VALIDATION, e.getMessage()).timed(startedAt, clock.instant());
            metricsConfig.recordExecution(timerSample, task.getScheduleType(), false);
            return result;
        }

        try {
            task.markRunStarted(startedAt);
            taskStore.update(task);

            var options = task.getSummaryOptions();
            var windowEnd = startedAt;
            var windowStart = windowEnd.minus(Duration.ofHours(options.getTimeRangeHours()));

            List<ContentItem> items = callWithDeadline(
                    () -> contentSource.fetch(task.getSourceRef(), windowStart, windowEnd, options),
                    properties.getFetchTimeout(), deadline, "content fetch");
            if (items == null) {
                items = List.of();
            }

            if (items.size() < options.getMinItems()) {
                log.info("Task {} found {} items, needs {}", taskId, items.size(), options.getMinItems());
                result = TaskExecutionResult.insufficientContent(taskId,
                        String.format("Insufficient content: %d items found, %d required", items.size(), options.getMinItems()),
                        items.size(), options.getMinItems());
            } else {
                var fetched = items;
                ProductionResult production = callWithDeadline(
                        () -> artifactProducer.produce(task, fetched),
                        properties.getProduceTimeout(), deadline, "summary production");

                if (production == null || !production.isProduced()) {
                    var reason = production != null ? production.getInsufficientReason() : "Producer returned no result";
                    result = TaskExecutionResult.insufficientContent(taskId, reason, items.size(), options.getMinItems());
                } else {
                    var artifact = production.getArtifact().toBuilder()
                            .taskId(taskId)
                            .sourceRef(task.getSourceRef())
                            .windowStart(windowStart)
                            .windowEnd(windowEnd)
                            .itemCount(items.size())
                            .build();

                    result = TaskExecutionResult.success(taskId, artifact.getId());
                    result.setItemsProcessed(items.size());
                    result.setDeliveryResults(deliverAll(artifact, task.getEnabledDestinations()));
                }
            }
        } catch (ContentAccessException e) {
            log.warn("Task {} cannot read source {}: {}", taskId, task.getSourceRef(), e.getMessage());
            result = TaskExecutionResult.failure(taskId, ErrorKind.CONTENT_ACCESS, e);
            result.withDetail("reason", e.getReason().name());
        } catch (TimeoutException e) {
            log.warn("Task {} timed out: {}", taskId, e.getMessage());
            result = TaskExecutionResult.failure(taskId, ErrorKind.TIMEOUT, e.getMessage());
        } catch (Exception e) {
            log.error("Unexpected error executing task {}: {}", taskId, e.getMessage(), e);
            result = TaskExecutionResult.failure(taskId, ErrorKind.INFRASTRUCTURE, e);
        }

        result.timed(startedAt, clock.instant());
        task.setLastExecutionStatus(result.getStatus());
        metricsConfig.recordExecution(timerSample, task.getScheduleType(), result.isSuccess());

        if (result.isSuccess()) {
            log.info("Task {} completed in {}ms, {}/{} deliveries succeeded", taskId, result.getDurationMs(),
                    result.getSuccessfulDeliveries(), result.getDeliveryResults().size());
        } else {
            log.warn("Task {} failed after {}ms ({}): {}", taskId, result.getDurationMs(), result.getErrorKind(), result.getErrorMessage());
        }
        return result;
    }

    /**
     * Purge execution results and inactive tasks beyond the retention window
     */
    public TaskExecutionResult runCleanup(CleanupTask cleanupTask) {
        var startedAt = clock.instant();
        log.info("Starting retention cleanup, keeping {} days", cleanupTask.getRetentionDays());

        TaskExecutionResult result;
        try {
            var cutoff = startedAt.minus(Duration.ofDays(cleanupTask.getRetentionDays()));
            var resultsRemoved = taskStore.cleanupResultsOlderThan(cutoff);
            var tasksRemoved = taskStore.cleanupOlderThan(cleanupTask.getRetentionDays());

            result = TaskExecutionResult.success(cleanupTask.getId(), null);
            result.setItemsProcessed(resultsRemoved + tasksRemoved);
            result.withDetail("resultsRemoved", resultsRemoved).withDetail("tasksRemoved", tasksRemoved);
        } catch (Exception e) {
            log.error("Retention cleanup failed: {}", e.getMessage(), e);
            result = TaskExecutionResult.failure(cleanupTask.getId(), ErrorKind.INFRASTRUCTURE, e);
        }
        return result.timed(startedAt, clock.instant());
    }

    private void validate(ScheduledTask task) {
        if (task.getSourceRef() == null || task.getSourceRef().isBlank()) {
            throw new IllegalArgumentException("Task source reference is required");
        }
        if (task.getSummaryOptions() == null) {
            throw new IllegalArgumentException("Task summary options are required");
        }
    }

    private List<DeliveryOutcome> deliverAll(SummaryArtifact artifact, List<Destination> destinations) {
        var outcomes = new ArrayList<DeliveryOutcome>(destinations.size());
        for (var destination : destinations) {
            var outcome = deliver(artifact, destination);
            metricsConfig.recordDelivery(destination.getType(), outcome.isSuccess());
            outcomes.add(outcome);
        }
        return outcomes;
    }

    private DeliveryOutcome deliver(SummaryArtifact artifact, Destination destination) {
        var sink = sinkRegistry.getSink(destination.getType());
        if (sink.isEmpty()) {
            log.warn("No delivery sink for {}, skipping {}", destination.getType(), destination.describe());
            return DeliveryOutcome.failed(destination, "No delivery sink for destination type " + destination.getType());
        }
        try {
            var outcome = sink.get().deliver(artifact, destination);
            return outcome != null ? outcome : DeliveryOutcome.failed(destination, "Sink returned no outcome");
        } catch (Exception e) {
            log.error("Delivery to {} failed: {}", destination.describe(), e.getMessage(), e);
            return DeliveryOutcome.failed(destination, e.getMessage());
        }
    }

    private <T> T callWithDeadline(Callable<T> call, Duration phaseTimeout, Instant deadline, String phase) throws Exception {
        var timeout = phaseTimeout;
        if (deadline != null) {
            var remaining = Duration.between(clock.instant(), deadline);
            if (remaining.compareTo(timeout) < 0) {
                timeout = remaining;
            }
        }
        if (timeout.isNegative() || timeout.isZero()) {
            throw new TimeoutException("Deadline passed before " + phase);
        }

        var future = collaboratorExecutor.submit(call);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new TimeoutException(phase + " exceeded " + timeout.toMillis() + "ms");
        } catch (ExecutionException e) {
            var cause = e.getCause();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            throw e;
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw e;
        }
    }
}
