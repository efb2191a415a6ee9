package com.example.summaryscheduler.dto;

import com.example.summaryscheduler.domain.entity.DeliveryOutcome;
import com.example.summaryscheduler.domain.enums.ErrorKind;
import com.example.summaryscheduler.domain.enums.ExecutionStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Response DTO for one execution of a task
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionResultResponse {

    private String taskId;
    private String executionId;
    private boolean success;
    private ExecutionStatus status;
    private String artifactId;
    private ErrorKind errorKind;
    private String errorMessage;
    private Map<String, Object> details;
    private List<DeliveryOutcome> deliveryResults;
    private Instant startedAt;
    private Instant completedAt;
    private long durationMs;
    private int itemsProcessed;
}
