package com.example.summaryscheduler.service.recurrence;

import com.example.summaryscheduler.config.SummarySchedulerProperties;
import com.example.summaryscheduler.domain.entity.RecurrenceRule;
import com.example.summaryscheduler.domain.entity.ScheduledTask;
import com.example.summaryscheduler.domain.enums.ScheduleType;
import com.example.summaryscheduler.exception.InvalidScheduleException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneId;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Registry of recurrence strategies.
 * <p>
 * Discovers every {@link RecurrenceStrategy} bean and dispatches by schedule type.
 * All calculations happen in the configured scheduler zone.
 */
@Slf4j
@Component
public class RecurrenceCalculator {

    private final Map<ScheduleType, RecurrenceStrategy> strategies = new EnumMap<>(ScheduleType.class);

    @Getter
    private final ZoneId zone;

    @Autowired
    public RecurrenceCalculator(List<RecurrenceStrategy> strategyBeans, SummarySchedulerProperties properties) {
        this(strategyBeans, ZoneId.of(properties.getZone()));
    }

    public RecurrenceCalculator(List<RecurrenceStrategy> strategyBeans, ZoneId zone) {
        this.zone = zone;
        for (var strategy : strategyBeans) {
            var type = strategy.getScheduleType();
            if (strategies.containsKey(type)) {
                log.warn("Duplicate recurrence strategy for {}: {} will override {}",
                        type, strategy.getClass().getSimpleName(),
                        strategies.get(type).getClass().getSimpleName());
            }
            strategies.put(type, strategy);
            log.debug("Registered recurrence strategy for {}: {}", type, strategy.getClass().getSimpleName());
        }

        for (var type : ScheduleType.values()) {
            if (!strategies.containsKey(type)) {
                log.warn("No recurrence strategy registered for schedule type: {}", type);
            }
        }
    }

    /**
     * Validate a rule before anything is persisted
     *
     * @throws InvalidScheduleException if the rule is missing, has no type, or is malformed for its type
     */
    public void validate(RecurrenceRule rule) {
        if (rule == null || rule.getType() == null) {
            throw new InvalidScheduleException(null, "Schedule type is required");
        }
        getStrategyOrThrow(rule.getType()).validate(rule);
    }

    /**
     * Compute the next fire time strictly after {@code now}
     *
     * @param task The task to compute for
     * @param now  Reference instant
     * @return next fire instant, or empty when the task never fires again
     */
    public Optional<Instant> nextFire(ScheduledTask task, Instant now) {
        var rule = task.getRecurrence();
        validate(rule);

        var result = getStrategyOrThrow(rule.getType())
                .nextFire(task, now.atZone(zone))
                .map(next -> next.toInstant());

        result.ifPresent(next -> {
            if (!next.isAfter(now)) {
                throw new IllegalStateException("Computed fire time " + next + " is not after " + now + " for task " + task.getId());
            }
        });
        return result;
    }

    public String describe(RecurrenceRule rule) {
        if (rule == null || rule.getType() == null) {
            return "Unscheduled";
        }
        return getStrategy(rule.getType())
                .map(strategy -> strategy.describe(rule))
                .orElse(rule.getType().getDisplayName());
    }

    public Optional<RecurrenceStrategy> getStrategy(ScheduleType type) {
        return Optional.ofNullable(strategies.get(type));
    }

    public RecurrenceStrategy getStrategyOrThrow(ScheduleType type) {
        return getStrategy(type).orElseThrow(() -> new IllegalArgumentException("No recurrence strategy registered for schedule type: " + type));
    }

    public Set<ScheduleType> getRegisteredTypes() {
        return strategies.keySet();
    }
}
