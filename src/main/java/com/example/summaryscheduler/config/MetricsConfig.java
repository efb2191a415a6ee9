package com.example.summaryscheduler.config;

import com.example.summaryscheduler.domain.enums.DestinationType;
import com.example.summaryscheduler.domain.enums.ErrorKind;
import com.example.summaryscheduler.domain.enums.ScheduleType;
import com.example.summaryscheduler.service.scheduler.TaskRegistry;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;

/**
 * Metrics for monitoring scheduler health and performance.
 * <p>
 * Exposes Prometheus metrics for:
 * - Registered, active, disabled and executing tasks
 * - Execution times by schedule type
 * - Failures by error kind
 * - Delivery outcomes by destination type
 */
@Configuration
@RequiredArgsConstructor
public class MetricsConfig {

    private final MeterRegistry meterRegistry;
    private final TaskRegistry taskRegistry;

    @PostConstruct
    public void initializeMetrics() {
        Gauge.builder("summary_scheduler_tasks", taskRegistry, TaskRegistry::size)
                .tag("state", "registered")
                .description("Number of registered tasks")
                .register(meterRegistry);

        Gauge.builder("summary_scheduler_tasks", taskRegistry, TaskRegistry::activeCount)
                .tag("state", "active")
                .description("Number of active tasks")
                .register(meterRegistry);

        Gauge.builder("summary_scheduler_tasks", taskRegistry, TaskRegistry::disabledCount)
                .tag("state", "disabled")
                .description("Number of tasks disabled after repeated failures")
                .register(meterRegistry);

        Gauge.builder("summary_scheduler_executing", taskRegistry, TaskRegistry::executingCount)
                .description("Number of tasks currently executing")
                .register(meterRegistry);
    }

    public Timer.Sample startExecutionTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordExecution(Timer.Sample sample, ScheduleType scheduleType, boolean success) {
        sample.stop(Timer.builder("summary_scheduler_execution_time")
                .tag("schedule_type", scheduleType != null ? scheduleType.getCode() : "unknown")
                .tag("success", String.valueOf(success))
                .description("Task execution time")
                .register(meterRegistry));
    }

    public void recordFailure(ErrorKind errorKind) {
        meterRegistry.counter("summary_scheduler_failures",
                "error_kind", errorKind != null ? errorKind.getCode() : "unknown"
        ).increment();
    }

    public void recordDelivery(DestinationType destinationType, boolean success) {
        meterRegistry.counter("summary_scheduler_deliveries",
                "destination_type", destinationType != null ? destinationType.getCode() : "unknown",
                "success", String.valueOf(success)
        ).increment();
    }

    public void recordRetry(int attemptNumber) {
        meterRegistry.counter("summary_scheduler_retries",
                "attempt", String.valueOf(attemptNumber)
        ).increment();
    }

    public void recordTaskDisabled() {
        meterRegistry.counter("summary_scheduler_tasks_disabled").increment();
    }
}
