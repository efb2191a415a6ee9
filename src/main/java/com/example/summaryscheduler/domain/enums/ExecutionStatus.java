package com.example.summaryscheduler.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Status of the most recent execution of a task.
 */
@Getter
@RequiredArgsConstructor
public enum ExecutionStatus {

    PENDING("pending", false),
    RUNNING("running", false),
    COMPLETED("completed", true),
    FAILED("failed", true);

    private final String code;
    private final boolean terminal;
}
