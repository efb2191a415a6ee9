package com.example.summaryscheduler.domain.entity;

import com.example.summaryscheduler.domain.enums.ScheduleType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

/**
 * When a task fires.
 * <p>
 * Only the fields relevant to {@link #type} are consulted:
 * {@code days} for WEEKLY, {@code cronExpression} for CUSTOM, {@code runAt} for ONCE
 * and {@code dayOfMonth} for MONTHLY. {@code timeOfDay} applies to DAILY, WEEKLY and MONTHLY.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RecurrenceRule {

    private ScheduleType type;

    private LocalTime timeOfDay;

    @Builder.Default
    private List<DayOfWeek> days = new ArrayList<>();

    /**
     * Five fields: minute hour day-of-month month day-of-week
     */
    private String cronExpression;

    private Instant runAt;

    /**
     * Anchor day for MONTHLY rules. Filled from the creation date when absent.
     */
    private Integer dayOfMonth;

    public static RecurrenceRule once(Instant runAt) {
        return RecurrenceRule.builder().type(ScheduleType.ONCE).runAt(runAt).build();
    }

    public static RecurrenceRule daily(LocalTime timeOfDay) {
        return RecurrenceRule.builder().type(ScheduleType.DAILY).timeOfDay(timeOfDay).build();
    }

    public static RecurrenceRule weekly(LocalTime timeOfDay, List<DayOfWeek> days) {
        return RecurrenceRule.builder()
                .type(ScheduleType.WEEKLY)
                .timeOfDay(timeOfDay)
                .days(new ArrayList<>(days))
                .build();
    }

    public static RecurrenceRule monthly(LocalTime timeOfDay, Integer dayOfMonth) {
        return RecurrenceRule.builder().type(ScheduleType.MONTHLY).timeOfDay(timeOfDay).dayOfMonth(dayOfMonth).build();
    }

    public static RecurrenceRule cron(String cronExpression) {
        return RecurrenceRule.builder().type(ScheduleType.CUSTOM).cronExpression(cronExpression).build();
    }
}
