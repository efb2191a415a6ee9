package com.example.summaryscheduler.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Recurrence variants a summary task can be scheduled with.
 */
@Getter
@RequiredArgsConstructor
public enum ScheduleType {

    /**
     * Fires a single time, then the task completes.
     */
    ONCE("once", "One-time", false),

    /**
     * Fires every day at the configured time of day.
     */
    DAILY("daily", "Daily", true),

    /**
     * Fires on each selected weekday at the configured time of day.
     */
    WEEKLY("weekly", "Weekly", true),

    /**
     * Fires once a month on the anchored day, clamped to the month's last day.
     */
    MONTHLY("monthly", "Monthly", true),

    /**
     * Fires according to a five-field cron expression.
     */
    CUSTOM("custom", "Custom", true);

    private final String code;
    private final String displayName;

    /**
     * Whether a task of this type keeps firing after a successful run
     */
    private final boolean recurring;

    /**
     * Find ScheduleType by its code value
     */
    public static ScheduleType fromCode(String code) {
        for (var type : values()) {
            if (type.getCode().equalsIgnoreCase(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown schedule type code: " + code);
    }
}
