package com.example.summaryscheduler.domain.entity;

import com.example.summaryscheduler.domain.enums.ErrorKind;
import com.example.summaryscheduler.domain.enums.ExecutionStatus;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Represents the result of one task execution.
 * <p>
 * Success means an artifact was produced. Delivery failures are reported
 * per destination and do not turn a produced artifact into a failed run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskExecutionResult {

    private String taskId;

    @Builder.Default
    private String executionId = newExecutionId();

    private boolean success;

    private ExecutionStatus status;

    /**
     * Id of the produced artifact, null when nothing was produced
     */
    private String artifactId;

    /**
     * Why nothing was produced, null on success
     */
    private ErrorKind errorKind;

    private String errorMessage;

    /**
     * Error context on failure, counters for cleanup runs
     */
    @Builder.Default
    private Map<String, Object> details = new HashMap<>();

    private String stackTrace;

    @Builder.Default
    private List<DeliveryOutcome> deliveryResults = new ArrayList<>();

    private Instant startedAt;

    private Instant completedAt;

    private long durationMs;

    /**
     * Source items summarized, or items removed for cleanup runs
     */
    private int itemsProcessed;

    public static TaskExecutionResult success(String taskId, String artifactId) {
        return TaskExecutionResult.builder()
                .taskId(taskId)
                .success(true)
                .status(ExecutionStatus.COMPLETED)
                .artifactId(artifactId)
                .build();
    }

    public static TaskExecutionResult failure(String taskId, ErrorKind errorKind, String errorMessage) {
        return TaskExecutionResult.builder()
                .taskId(taskId)
                .success(false)
                .status(ExecutionStatus.FAILED)
                .errorKind(errorKind)
                .errorMessage(errorMessage)
                .build();
    }

    public static TaskExecutionResult failure(String taskId, ErrorKind errorKind, Exception e) {
        var result = failure(taskId, errorKind, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        result.setStackTrace(truncateStackTrace(e));
        result.getDetails().put("exception", e.getClass().getSimpleName());
        return result;
    }

    /**
     * Not enough content to summarize. Kept distinct from other failures so the
     * failure policy can decide whether it counts against the task.
     */
    public static TaskExecutionResult insufficientContent(String taskId, String errorMessage, int found, int required) {
        var result = failure(taskId, ErrorKind.INSUFFICIENT_CONTENT, errorMessage);
        result.getDetails().put("itemsFound", found);
        result.getDetails().put("itemsRequired", required);
        result.setItemsProcessed(found);
        return result;
    }

    @JsonIgnore
    public boolean isInsufficientContent() {
        return errorKind == ErrorKind.INSUFFICIENT_CONTENT;
    }

    @JsonIgnore
    public long getSuccessfulDeliveries() {
        return deliveryResults.stream().filter(DeliveryOutcome::isSuccess).count();
    }

    @JsonIgnore
    public long getFailedDeliveries() {
        return deliveryResults.stream().filter(outcome -> !outcome.isSuccess()).count();
    }

    /**
     * Stamp start/end times and duration
     */
    public TaskExecutionResult timed(Instant startedAt, Instant completedAt) {
        this.startedAt = startedAt;
        this.completedAt = completedAt;
        this.durationMs = Duration.between(startedAt, completedAt).toMillis();
        return this;
    }

    public TaskExecutionResult withDetail(String key, Object value) {
        if (this.details == null) {
            this.details = new HashMap<>();
        }
        this.details.put(key, value);
        return this;
    }

    private static String newExecutionId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Truncate stack trace to keep stored history small
     */
    private static String truncateStackTrace(Exception e) {
        var sb = new StringBuilder();
        sb.append(e.getClass().getName()).append(": ").append(e.getMessage()).append("\n");

        var trace = e.getStackTrace();
        var maxLines = Math.min(trace.length, 20);
        for (var i = 0; i < maxLines; i++) {
            sb.append("\tat ").append(trace[i]).append("\n");
        }
        if (trace.length > maxLines) {
            sb.append("\t... ").append(trace.length - maxLines).append(" more\n");
        }

        var result = sb.toString();
        if (result.length() > 4000) {
            result = result.substring(0, 4000) + "...";
        }
        return result;
    }
}
