package com.example.summaryscheduler.service.recurrence;

import com.example.summaryscheduler.domain.entity.RecurrenceRule;
import com.example.summaryscheduler.domain.entity.ScheduledTask;
import com.example.summaryscheduler.domain.enums.ScheduleType;
import com.example.summaryscheduler.exception.InvalidScheduleException;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Five-field cron rules (minute hour day-of-month month day-of-week),
 * evaluated with Spring's {@link CronExpression} at second zero.
 */
@Component
public class CronRecurrence implements RecurrenceStrategy {

    private static final int FIELD_COUNT = 5;

    @Override
    public ScheduleType getScheduleType() {
        return ScheduleType.CUSTOM;
    }

    @Override
    public void validate(RecurrenceRule rule) {
        parse(rule.getCronExpression());
    }

    @Override
    public Optional<ZonedDateTime> nextFire(ScheduledTask task, ZonedDateTime now) {
        var expression = parse(task.getRecurrence().getCronExpression());
        return Optional.ofNullable(expression.next(now));
    }

    @Override
    public String describe(RecurrenceRule rule) {
        return "Custom: " + rule.getCronExpression();
    }

    private CronExpression parse(String cron) {
        if (cron == null || cron.isBlank()) {
            throw new InvalidScheduleException(ScheduleType.CUSTOM, "Custom schedule requires a cron expression");
        }
        var normalized = cron.trim().replaceAll("\\s+", " ");
        if (normalized.split(" ").length != FIELD_COUNT) {
            throw new InvalidScheduleException(ScheduleType.CUSTOM,
                    "Cron expression must have " + FIELD_COUNT + " fields: " + cron);
        }
        try {
            return CronExpression.parse("0 " + normalized);
        } catch (IllegalArgumentException e) {
            throw new InvalidScheduleException(ScheduleType.CUSTOM, "Invalid cron expression '" + cron + "': " + e.getMessage(), e);
        }
    }
}
