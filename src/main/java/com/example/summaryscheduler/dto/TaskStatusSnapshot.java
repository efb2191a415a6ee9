package com.example.summaryscheduler.dto;

import com.example.summaryscheduler.domain.enums.ErrorKind;
import com.example.summaryscheduler.domain.enums.ExecutionStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Point-in-time view of a task's scheduling state.
 * <p>
 * {@code disabled} distinguishes a task switched off by repeated failures
 * from one that is merely failing and will retry.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskStatusSnapshot {

    private String taskId;
    private String name;
    private String schedule;
    private boolean active;
    private boolean disabled;
    private boolean executing;
    private int runCount;
    private int failureCount;
    private int maxFailures;
    private int insufficientContentCount;
    private String lastError;
    private ErrorKind lastErrorKind;
    private ExecutionStatus lastExecutionStatus;
    private Instant lastRun;
    private Instant nextRun;
}
