package com.example.summaryscheduler.domain.entity;

import com.example.summaryscheduler.domain.enums.ErrorKind;
import com.example.summaryscheduler.domain.enums.ExecutionStatus;
import com.example.summaryscheduler.domain.enums.ScheduleType;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * A recurring (or one-time) summary job.
 * <p>
 * The record carries its schedule, its delivery targets and the bookkeeping
 * the scheduler needs to survive restarts: last and next run, run and failure
 * counters and the last error.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ScheduledTask {

    private static final Pattern ID_PATTERN = Pattern.compile("[A-Za-z0-9_-]+");

    private String id;

    private String name;

    /**
     * Channel the content is fetched from
     */
    private String sourceRef;

    /**
     * Server or workspace owning the source channel
     */
    private String sourceGroup;

    private RecurrenceRule recurrence;

    @Builder.Default
    private List<Destination> destinations = new ArrayList<>();

    @Builder.Default
    private SummaryOptions summaryOptions = SummaryOptions.defaults();

    @Builder.Default
    @JsonProperty("is_active")
    private boolean active = true;

    private Instant createdAt;

    private String createdBy;

    private Instant updatedAt;

    private Instant lastRun;

    private Instant nextRun;

    private int runCount;

    private int failureCount;

    @Builder.Default
    private int maxFailures = 3;

    @Builder.Default
    private int retryDelayMinutes = 5;

    private String lastError;

    private ErrorKind lastErrorKind;

    @Builder.Default
    private ExecutionStatus lastExecutionStatus = ExecutionStatus.PENDING;

    /**
     * Runs skipped because the source had too little content
     */
    private int insufficientContentCount;

    /**
     * Destinations that will receive the next artifact, in declaration order
     */
    @JsonIgnore
    public List<Destination> getEnabledDestinations() {
        if (destinations == null) {
            return List.of();
        }
        return destinations.stream().filter(Destination::isEnabled).toList();
    }

    @JsonIgnore
    public ScheduleType getScheduleType() {
        return recurrence != null ? recurrence.getType() : null;
    }

    /**
     * Whether the failure budget has been exhausted
     */
    @JsonIgnore
    public boolean hasReachedMaxFailures() {
        return failureCount >= maxFailures;
    }

    /**
     * Disabled tasks are inactive because of failures, as opposed to paused by a user
     */
    @JsonIgnore
    public boolean isDisabled() {
        return !active && hasReachedMaxFailures();
    }

    @JsonIgnore
    public boolean isDue(Instant now) {
        return active && nextRun != null && !nextRun.isAfter(now);
    }

    /**
     * Record the start of an execution attempt
     */
    public void markRunStarted(Instant now) {
        this.lastRun = now;
        this.runCount++;
        this.lastExecutionStatus = ExecutionStatus.RUNNING;
        this.updatedAt = now;
    }

    /**
     * Check that an externally supplied record carries everything needed to schedule it
     *
     * @throws IllegalArgumentException naming the first missing field
     */
    public void validateRequiredFields() {
        if (!isValidId(id)) {
            throw new IllegalArgumentException("Task id is missing or malformed: " + id);
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Task name is required");
        }
        if (sourceRef == null || sourceRef.isBlank()) {
            throw new IllegalArgumentException("Task source reference is required");
        }
        if (recurrence == null || recurrence.getType() == null) {
            throw new IllegalArgumentException("Task schedule type is required");
        }
    }

    public static boolean isValidId(String id) {
        return id != null && ID_PATTERN.matcher(id).matches();
    }
}
