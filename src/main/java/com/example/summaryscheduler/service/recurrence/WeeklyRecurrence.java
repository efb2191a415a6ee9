package com.example.summaryscheduler.service.recurrence;

import com.example.summaryscheduler.domain.entity.RecurrenceRule;
import com.example.summaryscheduler.domain.entity.ScheduledTask;
import com.example.summaryscheduler.domain.enums.ScheduleType;
import com.example.summaryscheduler.exception.InvalidScheduleException;
import org.springframework.stereotype.Component;

import java.time.ZonedDateTime;
import java.time.format.TextStyle;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Fires on the earliest selected weekday whose slot is still ahead, wrapping
 * into next week when every slot of this week has passed.
 */
@Component
public class WeeklyRecurrence implements RecurrenceStrategy {

    @Override
    public ScheduleType getScheduleType() {
        return ScheduleType.WEEKLY;
    }

    @Override
    public void validate(RecurrenceRule rule) {
        if (rule.getDays() == null || rule.getDays().isEmpty()) {
            throw new InvalidScheduleException(ScheduleType.WEEKLY, "Weekly schedule requires at least one weekday");
        }
        if (rule.getDays().contains(null)) {
            throw new InvalidScheduleException(ScheduleType.WEEKLY, "Weekly schedule contains an empty weekday");
        }
    }

    @Override
    public Optional<ZonedDateTime> nextFire(ScheduledTask task, ZonedDateTime now) {
        var rule = task.getRecurrence();
        var days = EnumSet.copyOf(rule.getDays());
        var time = resolveTimeOfDay(rule, now);

        // offset 7 is today's weekday next week
        for (var offset = 0; offset <= 7; offset++) {
            var date = now.toLocalDate().plusDays(offset);
            if (!days.contains(date.getDayOfWeek())) {
                continue;
            }
            var candidate = ZonedDateTime.of(date, time, now.getZone());
            if (candidate.isAfter(now)) {
                return Optional.of(candidate);
            }
        }
        throw new IllegalStateException("No weekly slot found for task " + task.getId());
    }

    @Override
    public String describe(RecurrenceRule rule) {
        var days = rule.getDays() == null || rule.getDays().isEmpty() ? "" : EnumSet.copyOf(rule.getDays()).stream()
                .map(day -> day.getDisplayName(TextStyle.SHORT, Locale.ENGLISH))
                .collect(Collectors.joining(", "));
        return rule.getTimeOfDay() != null
                ? "Weekly on " + days + " at " + rule.getTimeOfDay()
                : "Weekly on " + days;
    }
}
