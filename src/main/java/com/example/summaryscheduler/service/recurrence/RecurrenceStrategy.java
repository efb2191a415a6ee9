package com.example.summaryscheduler.service.recurrence;

import com.example.summaryscheduler.domain.entity.RecurrenceRule;
import com.example.summaryscheduler.domain.entity.ScheduledTask;
import com.example.summaryscheduler.domain.enums.ScheduleType;
import com.example.summaryscheduler.exception.InvalidScheduleException;

import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Computes fire times for one recurrence variant.
 * <p>
 * Implementations must be stateless and deterministic: the same task and
 * reference time always give the same answer. Every returned time is strictly
 * after the reference time.
 */
public interface RecurrenceStrategy {

    /**
     * Get the schedule type this strategy handles
     */
    ScheduleType getScheduleType();

    /**
     * Next fire time strictly after {@code now}
     *
     * @param task The task being scheduled
     * @param now  Reference time, already in the scheduler zone
     * @return the next fire time, or empty when the task never fires again
     */
    Optional<ZonedDateTime> nextFire(ScheduledTask task, ZonedDateTime now);

    /**
     * Human readable form of the rule
     */
    String describe(RecurrenceRule rule);

    /**
     * Reject a rule that can never be evaluated (optional override)
     *
     * @throws InvalidScheduleException if the rule is malformed
     */
    default void validate(RecurrenceRule rule) {
    }

    default boolean supports(ScheduleType scheduleType) {
        return getScheduleType() == scheduleType;
    }

    /**
     * Time of day of the rule, or the current minute when the rule has none
     */
    default LocalTime resolveTimeOfDay(RecurrenceRule rule, ZonedDateTime now) {
        return rule.getTimeOfDay() != null
                ? rule.getTimeOfDay()
                : now.toLocalTime().truncatedTo(ChronoUnit.MINUTES);
    }
}
