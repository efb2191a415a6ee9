package com.example.summaryscheduler.dto;

import com.example.summaryscheduler.domain.entity.Destination;
import com.example.summaryscheduler.domain.entity.RecurrenceRule;
import com.example.summaryscheduler.domain.entity.SummaryOptions;
import com.example.summaryscheduler.domain.enums.ErrorKind;
import com.example.summaryscheduler.domain.enums.ExecutionStatus;
import com.example.summaryscheduler.domain.enums.ScheduleType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Response DTO for task data
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskResponse {

    private String id;
    private String name;
    private String sourceRef;
    private String sourceGroup;
    private ScheduleType scheduleType;
    private RecurrenceRule recurrence;

    /**
     * Human readable form of the recurrence
     */
    private String schedule;

    private List<Destination> destinations;
    private SummaryOptions summaryOptions;
    private boolean active;
    private boolean disabled;
    private Instant createdAt;
    private String createdBy;
    private Instant updatedAt;
    private Instant lastRun;
    private Instant nextRun;
    private int runCount;
    private int failureCount;
    private int maxFailures;
    private int retryDelayMinutes;
    private int insufficientContentCount;
    private String lastError;
    private ErrorKind lastErrorKind;
    private ExecutionStatus lastExecutionStatus;
}
