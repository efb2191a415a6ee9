package com.example.summaryscheduler.service.scheduler;

import com.example.summaryscheduler.config.SummarySchedulerProperties;
import com.example.summaryscheduler.domain.entity.CleanupTask;
import com.example.summaryscheduler.domain.entity.ScheduledTask;
import com.example.summaryscheduler.domain.entity.TaskExecutionResult;
import com.example.summaryscheduler.domain.enums.ErrorKind;
import com.example.summaryscheduler.domain.enums.ExecutionStatus;
import com.example.summaryscheduler.domain.enums.ScheduleType;
import com.example.summaryscheduler.domain.repository.TaskStore;
import com.example.summaryscheduler.dto.SchedulerStats;
import com.example.summaryscheduler.dto.TaskStatusSnapshot;
import com.example.summaryscheduler.exception.SchedulerNotRunningException;
import com.example.summaryscheduler.exception.TaskNotFoundException;
import com.example.summaryscheduler.service.alert.SlackAlertService;
import com.example.summaryscheduler.service.executor.SummaryTaskExecutor;
import com.example.summaryscheduler.service.recurrence.RecurrenceCalculator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Keeps every active task armed with a timer and runs it when due.
 * <p>
 * Flow:
 * 1. {@link #start()} loads persisted tasks and arms one timer per active task
 * 2. A firing timer hands the task to the bounded worker pool
 * 3. The executor runs the task and returns a result
 * 4. The failure policy updates counters and the next run, which is persisted
 *    and armed again
 * <p>
 * A task never overlaps itself. Cancelling a task does not abort an in-flight
 * run, but the run's completion will not write anything back for it.
 */
@Slf4j
@Service
public class TaskSchedulerService {

    private final TaskStore taskStore;
    private final TaskRegistry registry;
    private final RecurrenceCalculator recurrenceCalculator;
    private final FailurePolicy failurePolicy;
    private final SummaryTaskExecutor taskExecutor;
    private final TaskScheduler triggerScheduler;
    private final TaskExecutor workerExecutor;
    private final SlackAlertService slackAlertService;
    private final SummarySchedulerProperties properties;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public TaskSchedulerService(TaskStore taskStore, TaskRegistry registry, RecurrenceCalculator recurrenceCalculator,
                                FailurePolicy failurePolicy, SummaryTaskExecutor taskExecutor,
                                @Qualifier("triggerScheduler") TaskScheduler triggerScheduler,
                                @Qualifier("taskWorkerExecutor") TaskExecutor workerExecutor,
                                SlackAlertService slackAlertService, SummarySchedulerProperties properties, Clock clock) {
        this.taskStore = taskStore;
        this.registry = registry;
        this.recurrenceCalculator = recurrenceCalculator;
        this.failurePolicy = failurePolicy;
        this.taskExecutor = taskExecutor;
        this.triggerScheduler = triggerScheduler;
        this.workerExecutor = workerExecutor;
        this.slackAlertService = slackAlertService;
        this.properties = properties;
        this.clock = clock;
    }

    // === Lifecycle ===

    /**
     * Load all persisted tasks and arm their timers. Calling it again is a no-op.
     */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            log.debug("Scheduler already running");
            return;
        }

        var now = clock.instant();
        var tasks = taskStore.loadAll();
        for (var task : tasks) {
            registry.register(task);
            recover(task, now);
            arm(task);
        }
        log.info("Scheduler started with {} tasks ({} active)", tasks.size(), registry.activeCount());
    }

    /**
     * Cancel every timer. Task state is left untouched and in-flight runs finish.
     * Calling it again is a no-op.
     */
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            log.debug("Scheduler already stopped");
            return;
        }
        var cancelled = registry.cancelAllTriggers();
        log.info("Scheduler stopped, {} timers cancelled, {} runs still in flight", cancelled, registry.executingCount());
    }

    public boolean isRunning() {
        return running.get();
    }

    // === Task management ===

    /**
     * Validate, persist and arm a new task
     *
     * @return the task id
     * @throws SchedulerNotRunningException if the scheduler has not been started
     * @throws com.example.summaryscheduler.exception.InvalidScheduleException if the recurrence rule is malformed
     */
    public String schedule(ScheduledTask task) {
        if (!running.get()) {
            throw new SchedulerNotRunningException("schedule task " + task.getName());
        }
        recurrenceCalculator.validate(task.getRecurrence());

        var now = clock.instant();
        normalize(task, now);
        if (registry.contains(task.getId())) {
            throw new IllegalStateException("Task already scheduled: " + task.getId());
        }

        task.setNextRun(recurrenceCalculator.nextFire(task, now)
                .orElseThrow(() -> new IllegalArgumentException("Schedule never fires: " + recurrenceCalculator.describe(task.getRecurrence()))));

        taskStore.save(task);
        registry.register(task);
        arm(task);

        log.info("Scheduled task {} ({}) {}, next run at {}", task.getId(), task.getName(),
                recurrenceCalculator.describe(task.getRecurrence()), task.getNextRun());
        return task.getId();
    }

    /**
     * Remove a task's timer, registration and persisted record
     *
     * @return false if the task is unknown
     */
    public boolean cancel(String taskId) {
        var lock = registry.lockFor(taskId);
        lock.lock();
        try {
            var removed = registry.remove(taskId);
            var deleted = taskStore.delete(taskId);
            if (removed.isEmpty() && !deleted) {
                log.debug("Cancel requested for unknown task {}", taskId);
                return false;
            }
            if (registry.isExecuting(taskId)) {
                log.info("Cancelled task {}, its in-flight run will be discarded", taskId);
            } else {
                log.info("Cancelled task {}", taskId);
            }
            return true;
        } finally {
            lock.unlock();
            registry.discardLock(taskId);
        }
    }

    /**
     * Stop a task from firing. Its timer stays registered.
     *
     * @return false if the task is unknown
     */
    public boolean pause(String taskId) {
        var task = registry.get(taskId);
        if (task.isEmpty()) {
            return false;
        }

        var lock = registry.lockFor(taskId);
        lock.lock();
        try {
            task.get().setActive(false);
            task.get().setUpdatedAt(clock.instant());
            taskStore.update(task.get());
            log.info("Paused task {}", taskId);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Reactivate a task. The failure count is kept.
     */
    public boolean resume(String taskId) {
        return resume(taskId, false);
    }

    /**
     * Reactivate a task and arm it for its next slot
     *
     * @param resetFailures clear the failure count, e.g. after fixing the cause of a disable
     * @return false if the task is unknown or has no further slot
     */
    public boolean resume(String taskId, boolean resetFailures) {
        var found = registry.get(taskId);
        if (found.isEmpty()) {
            return false;
        }
        var task = found.get();

        var lock = registry.lockFor(taskId);
        lock.lock();
        try {
            var now = clock.instant();
            if (resetFailures) {
                failurePolicy.resetFailures(task);
            }
            if (task.getNextRun() == null || !task.getNextRun().isAfter(now)) {
                var next = recurrenceCalculator.nextFire(task, now);
                if (next.isEmpty()) {
                    log.warn("Task {} has no further runs, not resuming", taskId);
                    return false;
                }
                task.setNextRun(next.get());
            }
            task.setActive(true);
            task.setUpdatedAt(now);
            taskStore.update(task);
            arm(task);
            log.info("Resumed task {} (failures: {}/{}), next run at {}", taskId, task.getFailureCount(), task.getMaxFailures(), task.getNextRun());
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Run a task immediately, outside its schedule
     *
     * @throws TaskNotFoundException if the task is unknown
     * @throws IllegalStateException if the task is already executing
     */
    public CompletableFuture<TaskExecutionResult> triggerNow(String taskId) {
        if (!running.get()) {
            throw new SchedulerNotRunningException("run task " + taskId);
        }
        var task = registry.get(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
        if (!registry.tryMarkExecuting(taskId)) {
            throw new IllegalStateException("Task is already executing: " + taskId);
        }

        log.info("Manual run requested for task {}", taskId);
        try {
            return CompletableFuture.supplyAsync(() -> execute(task), workerExecutor);
        } catch (RuntimeException e) {
            registry.finishExecuting(taskId);
            throw e;
        }
    }

    public TaskExecutionResult runCleanup() {
        return runCleanup(properties.getRetentionDays());
    }

    /**
     * Purge results and inactive tasks older than the given number of days
     */
    public TaskExecutionResult runCleanup(int retentionDays) {
        var result = taskExecutor.runCleanup(CleanupTask.builder().retentionDays(retentionDays).build());
        for (var task : registry.all()) {
            if (!task.isActive() && taskStore.load(task.getId()).isEmpty()) {
                registry.remove(task.getId());
                registry.discardLock(task.getId());
                log.debug("Unregistered task {} removed by retention cleanup", task.getId());
            }
        }
        return result;
    }

    public boolean exportTasks(Path path) {
        return taskStore.export(path);
    }

    /**
     * Resolve a backup file name inside the configured backup directory
     *
     * @throws IllegalArgumentException if the name points outside that directory
     */
    public Path resolveBackupFile(String fileName) {
        var dir = Paths.get(properties.getBackupDir()).toAbsolutePath().normalize();
        if (fileName == null || fileName.isBlank()) {
            throw new IllegalArgumentException("Backup file name is required");
        }
        var file = dir.resolve(fileName).normalize();
        if (!file.startsWith(dir) || file.equals(dir)) {
            throw new IllegalArgumentException("Backup file must be inside the backup directory: " + fileName);
        }
        return file;
    }

    /**
     * Import task records from an export file and arm the imported tasks.
     * Records with an invalid recurrence rule are skipped.
     * Tasks currently executing keep their in-memory state.
     *
     * @return number of records imported
     */
    public int importTasks(Path path) {
        var imported = taskStore.importFrom(path, task -> recurrenceCalculator.validate(task.getRecurrence()));
        if (imported == 0 || !running.get()) {
            return imported;
        }

        var now = clock.instant();
        for (var task : taskStore.loadAll()) {
            if (registry.isExecuting(task.getId())) {
                continue;
            }
            var lock = registry.lockFor(task.getId());
            lock.lock();
            try {
                registry.cancelTrigger(task.getId());
                registry.register(task);
                recover(task, now);
                arm(task);
            } finally {
                lock.unlock();
            }
        }
        log.info("Imported {} tasks from {}, {} now registered", imported, path, registry.size());
        return imported;
    }

    // === Queries ===

    public Optional<ScheduledTask> getTask(String taskId) {
        return registry.get(taskId).or(() -> taskStore.load(taskId));
    }

    public Optional<TaskStatusSnapshot> status(String taskId) {
        return getTask(taskId).map(task -> TaskStatusSnapshot.builder()
                .taskId(task.getId())
                .name(task.getName())
                .schedule(recurrenceCalculator.describe(task.getRecurrence()))
                .active(task.isActive())
                .disabled(task.isDisabled())
                .executing(registry.isExecuting(task.getId()))
                .runCount(task.getRunCount())
                .failureCount(task.getFailureCount())
                .maxFailures(task.getMaxFailures())
                .insufficientContentCount(task.getInsufficientContentCount())
                .lastError(task.getLastError())
                .lastErrorKind(task.getLastErrorKind())
                .lastExecutionStatus(task.getLastExecutionStatus())
                .lastRun(task.getLastRun())
                .nextRun(task.getNextRun())
                .build());
    }

    public SchedulerStats stats() {
        return stats(properties.getStatsUpcomingCount());
    }

    public SchedulerStats stats(int upcomingCount) {
        var tasks = registry.all();
        var upcoming = tasks.stream()
                .filter(task -> task.isActive() && task.getNextRun() != null)
                .sorted(Comparator.comparing(ScheduledTask::getNextRun))
                .limit(upcomingCount)
                .map(task -> SchedulerStats.UpcomingRun.builder()
                        .taskId(task.getId())
                        .name(task.getName())
                        .nextRun(task.getNextRun())
                        .build())
                .toList();

        return SchedulerStats.builder()
                .running(running.get())
                .totalTasks(tasks.size())
                .activeTasks(tasks.stream().filter(ScheduledTask::isActive).count())
                .pausedTasks(tasks.stream().filter(task -> !task.isActive() && !task.isDisabled()).count())
                .disabledTasks(tasks.stream().filter(ScheduledTask::isDisabled).count())
                .scheduledTriggers(registry.triggerCount())
                .executingTasks(registry.executingCount())
                .nextRunTimes(upcoming)
                .generatedAt(clock.instant())
                .build();
    }

    /**
     * Registered tasks, optionally only those of one source or source group
     */
    public List<ScheduledTask> getScheduledTasks(String sourceRef) {
        return registry.all().stream()
                .filter(task -> sourceRef == null
                        || sourceRef.equals(task.getSourceRef())
                        || sourceRef.equals(task.getSourceGroup()))
                .sorted(Comparator.comparing(ScheduledTask::getCreatedAt, Comparator.nullsFirst(Comparator.naturalOrder())))
                .toList();
    }

    public List<TaskExecutionResult> getExecutionHistory(String taskId, int limit) {
        return taskStore.loadResults(taskId, limit);
    }

    // === Firing ===

    /**
     * Timer callback. Skips paused tasks and tasks still executing.
     */
    void fire(String taskId) {
        var found = registry.get(taskId);
        if (found.isEmpty() || !running.get()) {
            return;
        }
        var task = found.get();
        if (!task.isActive()) {
            log.debug("Task {} is paused, skipping trigger", taskId);
            return;
        }
        if (!registry.tryMarkExecuting(taskId)) {
            log.warn("Task {} is still executing, skipping overlapping trigger", taskId);
            return;
        }

        try {
            workerExecutor.execute(() -> execute(task));
        } catch (RuntimeException e) {
            registry.finishExecuting(taskId);
            log.error("Failed to dispatch task {}: {}", taskId, e.getMessage());
            handleTriggerError(task, e);
        }
    }

    private TaskExecutionResult execute(ScheduledTask task) {
        TaskExecutionResult result;
        try {
            result = taskExecutor.run(task);
        } catch (Exception e) {
            log.error("Executor raised for task {}: {}", task.getId(), e.getMessage(), e);
            result = TaskExecutionResult.failure(task.getId(), ErrorKind.INFRASTRUCTURE, e);
        }

        try {
            complete(task, result);
        } finally {
            registry.finishExecuting(task.getId());
        }
        return result;
    }

    /**
     * Apply a finished run to the task, persist it and arm the next timer
     */
    private void complete(ScheduledTask task, TaskExecutionResult result) {
        var taskId = task.getId();
        var lock = registry.lockFor(taskId);
        lock.lock();
        try {
            if (!registry.contains(taskId)) {
                log.info("Task {} was cancelled while executing, discarding result {}", taskId, result.getExecutionId());
                return;
            }

            var pausedDuringRun = !task.isActive();
            var now = clock.instant();
            FailurePolicy.Decision decision;
            try {
                decision = failurePolicy.apply(task, result, now);
            } catch (Exception e) {
                log.error("Failed to compute next run for task {}: {}", taskId, e.getMessage(), e);
                decision = failurePolicy.apply(task, TaskExecutionResult.failure(taskId, ErrorKind.INFRASTRUCTURE, e), now);
            }
            if (pausedDuringRun) {
                task.setNextRun(null);
            }

            persist(task);
            saveResult(result);
            registry.finishExecuting(taskId);

            if (decision == FailurePolicy.Decision.DISABLED) {
                slackAlertService.sendTaskDisabledAlert(task);
            } else if (!result.isSuccess() && !result.isInsufficientContent()) {
                slackAlertService.sendTaskFailureAlert(task, result);
            }

            if (!pausedDuringRun) {
                arm(task);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Arm a timer for the task's next run, if it is active and has one
     */
    private void arm(ScheduledTask task) {
        if (!running.get() || !task.isActive() || task.getNextRun() == null) {
            return;
        }
        var taskId = task.getId();
        try {
            var trigger = triggerScheduler.schedule(() -> fire(taskId), task.getNextRun());
            registry.setTrigger(taskId, trigger);
            log.debug("Armed task {} for {}", taskId, task.getNextRun());
        } catch (RuntimeException e) {
            log.error("Failed to arm timer for task {}: {}", taskId, e.getMessage());
            handleTriggerError(task, e);
        }
    }

    /**
     * Route a timer or dispatch failure through the failure policy
     */
    private void handleTriggerError(ScheduledTask task, Exception e) {
        var result = TaskExecutionResult.failure(task.getId(), ErrorKind.INFRASTRUCTURE, e);
        var now = clock.instant();
        result.timed(now, now);

        var lock = registry.lockFor(task.getId());
        lock.lock();
        try {
            if (!registry.contains(task.getId())) {
                return;
            }
            var decision = failurePolicy.apply(task, result, now);
            persist(task);
            saveResult(result);
            if (decision == FailurePolicy.Decision.DISABLED) {
                slackAlertService.sendTaskDisabledAlert(task);
                return;
            }
            arm(task);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Bring a task loaded from storage up to date: clear an interrupted run and
     * move a next run that passed while the scheduler was down to the next slot.
     * A pending retry, or an interrupted run with no regular slot left, fires right away.
     */
    private void recover(ScheduledTask task, Instant now) {
        var changed = false;
        var retryPending = failurePolicy.isRetryPending(task);
        var interrupted = task.getLastExecutionStatus() == ExecutionStatus.RUNNING;
        if (interrupted) {
            log.warn("Task {} was interrupted by a restart during its last run", task.getId());
            task.setLastExecutionStatus(ExecutionStatus.FAILED);
            task.setLastError("Execution interrupted by scheduler restart");
            task.setLastErrorKind(ErrorKind.INFRASTRUCTURE);
            changed = true;
        }

        if (task.isActive() && (task.getNextRun() == null || !task.getNextRun().isAfter(now))) {
            try {
                var next = retryPending ? Optional.<Instant>empty() : recurrenceCalculator.nextFire(task, now);
                if (next.isPresent()) {
                    log.info("Task {} missed its run at {}, next run at {}", task.getId(), task.getNextRun(), next.get());
                    task.setNextRun(next.get());
                } else if (retryPending || interrupted) {
                    log.info("Task {} missed its retry at {}, retrying now ({}/{} failures)",
                            task.getId(), task.getNextRun(), task.getFailureCount(), task.getMaxFailures());
                    task.setNextRun(now);
                } else {
                    task.setActive(false);
                    task.setNextRun(null);
                }
                changed = true;
            } catch (Exception e) {
                log.error("Cannot compute next run for task {}: {}", task.getId(), e.getMessage());
                handleTriggerError(task, e);
                return;
            }
        }

        if (changed) {
            task.setUpdatedAt(now);
            persist(task);
        }
    }

    private void normalize(ScheduledTask task, Instant now) {
        if (task.getId() == null || task.getId().isBlank()) {
            task.setId(UUID.randomUUID().toString());
        } else if (!ScheduledTask.isValidId(task.getId())) {
            throw new IllegalArgumentException("Task id may only contain letters, digits, '-' and '_': " + task.getId());
        }
        if (task.getCreatedAt() == null) {
            task.setCreatedAt(now);
        }

        var rule = task.getRecurrence();
        if (rule.getDays() != null) {
            rule.setDays(rule.getDays().stream().filter(Objects::nonNull).distinct().sorted().toList());
        }
        if (rule.getType() == ScheduleType.MONTHLY && rule.getDayOfMonth() == null) {
            rule.setDayOfMonth(task.getCreatedAt().atZone(recurrenceCalculator.getZone()).getDayOfMonth());
        }

        task.setActive(true);
        task.setLastRun(null);
        task.setRunCount(0);
        task.setFailureCount(0);
        task.setLastExecutionStatus(ExecutionStatus.PENDING);
        task.setUpdatedAt(now);
    }

    private void persist(ScheduledTask task) {
        try {
            if (!taskStore.update(task)) {
                log.info("Task {} no longer stored, not writing its state", task.getId());
            }
        } catch (RuntimeException e) {
            log.error("Failed to persist task {}: {}", task.getId(), e.getMessage(), e);
        }
    }

    private void saveResult(TaskExecutionResult result) {
        try {
            taskStore.saveResult(result);
        } catch (RuntimeException e) {
            log.error("Failed to store result {} of task {}: {}", result.getExecutionId(), result.getTaskId(), e.getMessage());
        }
    }
}
