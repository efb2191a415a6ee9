package com.example.summaryscheduler.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Classification of why a task execution did not produce an artifact.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorKind {

    /**
     * Task definition is malformed. Raised before anything is persisted.
     */
    VALIDATION("validation", false),

    /**
     * Fewer source items than the task's minimum, or the producer declined.
     */
    INSUFFICIENT_CONTENT("insufficient-content", true),

    /**
     * Source was missing or access was denied.
     */
    CONTENT_ACCESS("content-access", true),

    /**
     * Fetch or production did not finish before the deadline.
     */
    TIMEOUT("timeout", true),

    /**
     * Persistence, timer or any unexpected failure.
     */
    INFRASTRUCTURE("infrastructure", true);

    private final String code;

    /**
     * Whether a later attempt might succeed without changing the task
     */
    private final boolean retryable;
}
