package com.example.summaryscheduler.dto;

import com.example.summaryscheduler.domain.entity.Destination;
import com.example.summaryscheduler.domain.entity.SummaryOptions;
import com.example.summaryscheduler.domain.enums.ScheduleType;
import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.util.List;

/**
 * Request DTO for scheduling a new summary task
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateTaskRequest {

    /**
     * Optional caller-chosen id, generated when absent
     */
    @Pattern(regexp = "[A-Za-z0-9_-]+", message = "Task id may only contain letters, digits, '-' and '_'")
    private String id;

    @NotBlank(message = "Task name is required")
    private String name;

    @NotBlank(message = "Source reference is required")
    private String sourceRef;

    private String sourceGroup;

    @NotNull(message = "Schedule type is required")
    private ScheduleType scheduleType;

    /**
     * Time of day for DAILY, WEEKLY and MONTHLY schedules (HH:mm)
     */
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "HH:mm")
    private LocalTime timeOfDay;

    /**
     * Weekdays for WEEKLY schedules
     */
    private List<DayOfWeek> days;

    /**
     * Five-field cron expression for CUSTOM schedules
     */
    private String cronExpression;

    /**
     * Fire time for ONCE schedules
     */
    private Instant runAt;

    @Min(value = 1, message = "Day of month must be between 1 and 31")
    @Max(value = 31, message = "Day of month must be between 1 and 31")
    private Integer dayOfMonth;

    private List<Destination> destinations;

    private SummaryOptions summaryOptions;

    @Min(value = 1, message = "Max failures must be at least 1")
    private Integer maxFailures;

    @Min(value = 1, message = "Retry delay must be at least 1 minute")
    private Integer retryDelayMinutes;

    private String createdBy;
}
