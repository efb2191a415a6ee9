package com.example.summaryscheduler.service.recurrence;

import com.example.summaryscheduler.domain.entity.RecurrenceRule;
import com.example.summaryscheduler.domain.entity.ScheduledTask;
import com.example.summaryscheduler.domain.enums.ScheduleType;
import org.springframework.stereotype.Component;

import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Fires at the rule's target instant, or right away when that instant has passed.
 * Never fires again once the task has run.
 */
@Component
public class OnceRecurrence implements RecurrenceStrategy {

    static final long OVERDUE_DELAY_SECONDS = 1;

    @Override
    public ScheduleType getScheduleType() {
        return ScheduleType.ONCE;
    }

    @Override
    public Optional<ZonedDateTime> nextFire(ScheduledTask task, ZonedDateTime now) {
        if (task.getLastRun() != null) {
            return Optional.empty();
        }

        var runAt = task.getRecurrence().getRunAt();
        if (runAt != null) {
            var target = runAt.atZone(now.getZone());
            if (target.isAfter(now)) {
                return Optional.of(target);
            }
        }
        return Optional.of(now.plusSeconds(OVERDUE_DELAY_SECONDS));
    }

    @Override
    public String describe(RecurrenceRule rule) {
        return rule.getRunAt() != null ? "Once at " + rule.getRunAt() : "Once, as soon as possible";
    }
}
