package com.example.summaryscheduler.service.recurrence;

import com.example.summaryscheduler.domain.entity.RecurrenceRule;
import com.example.summaryscheduler.domain.entity.ScheduledTask;
import com.example.summaryscheduler.domain.enums.ScheduleType;
import org.springframework.stereotype.Component;

import java.time.ZonedDateTime;
import java.util.Optional;

@Component
public class DailyRecurrence implements RecurrenceStrategy {

    @Override
    public ScheduleType getScheduleType() {
        return ScheduleType.DAILY;
    }

    @Override
    public Optional<ZonedDateTime> nextFire(ScheduledTask task, ZonedDateTime now) {
        var time = resolveTimeOfDay(task.getRecurrence(), now);
        var today = ZonedDateTime.of(now.toLocalDate(), time, now.getZone());
        if (today.isAfter(now)) {
            return Optional.of(today);
        }
        return Optional.of(ZonedDateTime.of(now.toLocalDate().plusDays(1), time, now.getZone()));
    }

    @Override
    public String describe(RecurrenceRule rule) {
        return rule.getTimeOfDay() != null ? "Daily at " + rule.getTimeOfDay() : "Daily";
    }
}
