package com.example.summaryscheduler.exception;

import com.example.summaryscheduler.domain.enums.ScheduleType;
import lombok.Getter;

/**
 * Exception for recurrence rules that cannot be scheduled
 */
@Getter
public class InvalidScheduleException extends RuntimeException {

    private final ScheduleType scheduleType;

    public InvalidScheduleException(ScheduleType scheduleType, String message) {
        super(message);
        this.scheduleType = scheduleType;
    }

    public InvalidScheduleException(ScheduleType scheduleType, String message, Throwable cause) {
        super(message, cause);
        this.scheduleType = scheduleType;
    }
}
