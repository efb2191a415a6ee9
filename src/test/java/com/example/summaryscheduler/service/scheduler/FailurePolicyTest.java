package com.example.summaryscheduler.service.scheduler;

import com.example.summaryscheduler.config.MetricsConfig;
import com.example.summaryscheduler.config.SummarySchedulerProperties;
import com.example.summaryscheduler.domain.entity.RecurrenceRule;
import com.example.summaryscheduler.domain.entity.ScheduledTask;
import com.example.summaryscheduler.domain.entity.TaskExecutionResult;
import com.example.summaryscheduler.domain.enums.ErrorKind;
import com.example.summaryscheduler.domain.enums.ExecutionStatus;
import com.example.summaryscheduler.service.recurrence.DailyRecurrence;
import com.example.summaryscheduler.service.recurrence.OnceRecurrence;
import com.example.summaryscheduler.service.recurrence.RecurrenceCalculator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("FailurePolicy Tests")
class FailurePolicyTest {

    private static final Instant NOW = Instant.parse("2024-01-01T10:00:00Z");

    @Mock
    private MetricsConfig metricsConfig;

    private SummarySchedulerProperties properties;
    private FailurePolicy failurePolicy;
    private ScheduledTask task;

    @BeforeEach
    void setUp() {
        properties = new SummarySchedulerProperties();
        var calculator = new RecurrenceCalculator(List.of(new DailyRecurrence(), new OnceRecurrence()), ZoneOffset.UTC);
        failurePolicy = new FailurePolicy(calculator, properties, metricsConfig);

        task = ScheduledTask.builder()
                .id("daily-digest")
                .name("Daily digest")
                .sourceRef("channel-1")
                .recurrence(RecurrenceRule.daily(LocalTime.of(9, 0)))
                .maxFailures(3)
                .retryDelayMinutes(5)
                .build();
    }

    private TaskExecutionResult failure() {
        return TaskExecutionResult.failure(task.getId(), ErrorKind.INFRASTRUCTURE, "Summary service unavailable");
    }

    @Nested
    @DisplayName("On success")
    class SuccessTests {

        @Test
        @DisplayName("Should reset failure count and schedule the next regular slot")
        void shouldResetFailuresOnSuccess() {
            // Given
            task.setFailureCount(2);
            task.setLastError("previous error");

            // When
            var decision = failurePolicy.apply(task, TaskExecutionResult.success(task.getId(), "artifact-1"), NOW);

            // Then
            assertThat(decision).isEqualTo(FailurePolicy.Decision.RESCHEDULED);
            assertThat(task.getFailureCount()).isZero();
            assertThat(task.getLastError()).isNull();
            assertThat(task.getLastExecutionStatus()).isEqualTo(ExecutionStatus.COMPLETED);
            assertThat(task.getNextRun()).isEqualTo(Instant.parse("2024-01-02T09:00:00Z"));
        }

        @Test
        @DisplayName("Should complete a one-time task after it ran")
        void shouldCompleteOneTimeTask() {
            task.setRecurrence(RecurrenceRule.once(NOW.minusSeconds(60)));
            task.setLastRun(NOW.minusSeconds(5));

            var decision = failurePolicy.apply(task, TaskExecutionResult.success(task.getId(), "artifact-1"), NOW);

            assertThat(decision).isEqualTo(FailurePolicy.Decision.COMPLETED);
            assertThat(task.isActive()).isFalse();
            assertThat(task.getNextRun()).isNull();
        }
    }

    @Nested
    @DisplayName("On failure")
    class FailureTests {

        @Test
        @DisplayName("Should schedule a backoff retry below the failure budget")
        void shouldScheduleRetry() {
            var decision = failurePolicy.apply(task, failure(), NOW);

            assertThat(decision).isEqualTo(FailurePolicy.Decision.RETRY_SCHEDULED);
            assertThat(task.getFailureCount()).isEqualTo(1);
            assertThat(task.isActive()).isTrue();
            assertThat(task.getNextRun()).isEqualTo(NOW.plus(Duration.ofMinutes(5)));
            assertThat(task.getLastErrorKind()).isEqualTo(ErrorKind.INFRASTRUCTURE);
            verify(metricsConfig).recordRetry(1);
        }

        @Test
        @DisplayName("Should double the retry delay for each consecutive failure")
        void shouldBackOffExponentially() {
            failurePolicy.apply(task, failure(), NOW);
            failurePolicy.apply(task, failure(), NOW);

            assertThat(task.getFailureCount()).isEqualTo(2);
            assertThat(task.getNextRun()).isEqualTo(NOW.plus(Duration.ofMinutes(10)));
        }

        @Test
        @DisplayName("Should cap the retry delay")
        void shouldCapRetryDelay() {
            properties.setMaxRetryDelay(Duration.ofMinutes(30));
            task.setRetryDelayMinutes(60);
            task.setFailureCount(1);

            assertThat(failurePolicy.retryDelay(task)).isEqualTo(Duration.ofMinutes(30));
        }

        @Test
        @DisplayName("Should disable the task once max failures is reached")
        void shouldDisableAtMaxFailures() {
            for (var i = 0; i < 3; i++) {
                failurePolicy.apply(task, failure(), NOW);
            }

            assertThat(task.getFailureCount()).isEqualTo(3);
            assertThat(task.isActive()).isFalse();
            assertThat(task.isDisabled()).isTrue();
            assertThat(task.getNextRun()).isNull();
            verify(metricsConfig).recordTaskDisabled();
        }
    }

    @Nested
    @DisplayName("On insufficient content")
    class InsufficientContentTests {

        @Test
        @DisplayName("Should keep the regular schedule without consuming the failure budget")
        void shouldNotCountAsFailureByDefault() {
            var result = TaskExecutionResult.insufficientContent(task.getId(), "Only 2 messages", 2, 5);

            var decision = failurePolicy.apply(task, result, NOW);

            assertThat(decision).isEqualTo(FailurePolicy.Decision.RESCHEDULED);
            assertThat(task.getFailureCount()).isZero();
            assertThat(task.getInsufficientContentCount()).isEqualTo(1);
            assertThat(task.getLastErrorKind()).isEqualTo(ErrorKind.INSUFFICIENT_CONTENT);
            assertThat(task.getNextRun()).isEqualTo(Instant.parse("2024-01-02T09:00:00Z"));
            verify(metricsConfig, never()).recordRetry(1);
        }

        @Test
        @DisplayName("Should count as failure when configured to")
        void shouldCountAsFailureWhenConfigured() {
            properties.setCountInsufficientContentAsFailure(true);
            var result = TaskExecutionResult.insufficientContent(task.getId(), "Only 2 messages", 2, 5);

            var decision = failurePolicy.apply(task, result, NOW);

            assertThat(decision).isEqualTo(FailurePolicy.Decision.RETRY_SCHEDULED);
            assertThat(task.getFailureCount()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Pending retry")
    class PendingRetryTests {

        @Test
        @DisplayName("Should report a pending retry after a counted failure")
        void shouldReportPendingRetry() {
            failurePolicy.apply(task, failure(), NOW);

            assertThat(failurePolicy.isRetryPending(task)).isTrue();
        }

        @Test
        @DisplayName("Should not report a retry once the task is disabled or succeeded")
        void shouldNotReportRetryWhenDisabledOrSucceeded() {
            failurePolicy.apply(task, TaskExecutionResult.success(task.getId(), "artifact-1"), NOW);
            assertThat(failurePolicy.isRetryPending(task)).isFalse();

            for (var i = 0; i < 3; i++) {
                failurePolicy.apply(task, failure(), NOW);
            }
            assertThat(failurePolicy.isRetryPending(task)).isFalse();
        }

        @Test
        @DisplayName("Should not treat uncounted insufficient content as a retry")
        void shouldIgnoreUncountedInsufficientContent() {
            failurePolicy.apply(task, failure(), NOW);
            failurePolicy.apply(task, TaskExecutionResult.insufficientContent(task.getId(), "Only 2 messages", 2, 5), NOW);

            assertThat(failurePolicy.isRetryPending(task)).isFalse();
        }
    }
}
