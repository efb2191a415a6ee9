package com.example.summaryscheduler.service.recurrence;

import com.example.summaryscheduler.domain.entity.RecurrenceRule;
import com.example.summaryscheduler.domain.entity.ScheduledTask;
import com.example.summaryscheduler.domain.enums.ScheduleType;
import com.example.summaryscheduler.exception.InvalidScheduleException;
import org.springframework.stereotype.Component;

import java.time.YearMonth;
import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Fires on the anchored day of the month following the reference time.
 * Days missing from the target month clamp to its last day.
 */
@Component
public class MonthlyRecurrence implements RecurrenceStrategy {

    @Override
    public ScheduleType getScheduleType() {
        return ScheduleType.MONTHLY;
    }

    @Override
    public void validate(RecurrenceRule rule) {
        var day = rule.getDayOfMonth();
        if (day != null && (day < 1 || day > 31)) {
            throw new InvalidScheduleException(ScheduleType.MONTHLY, "Day of month must be between 1 and 31, got " + day);
        }
    }

    @Override
    public Optional<ZonedDateTime> nextFire(ScheduledTask task, ZonedDateTime now) {
        var rule = task.getRecurrence();
        var anchorDay = resolveAnchorDay(task, now);
        var target = YearMonth.from(now).plusMonths(1);
        var day = Math.min(anchorDay, target.lengthOfMonth());

        return Optional.of(ZonedDateTime.of(target.atDay(day), resolveTimeOfDay(rule, now), now.getZone()));
    }

    @Override
    public String describe(RecurrenceRule rule) {
        var day = rule.getDayOfMonth() != null ? "day " + rule.getDayOfMonth() : "the creation day";
        return rule.getTimeOfDay() != null
                ? "Monthly on " + day + " at " + rule.getTimeOfDay()
                : "Monthly on " + day;
    }

    private int resolveAnchorDay(ScheduledTask task, ZonedDateTime now) {
        var rule = task.getRecurrence();
        if (rule.getDayOfMonth() != null) {
            return rule.getDayOfMonth();
        }
        if (task.getCreatedAt() != null) {
            return task.getCreatedAt().atZone(now.getZone()).getDayOfMonth();
        }
        return now.getDayOfMonth();
    }
}
