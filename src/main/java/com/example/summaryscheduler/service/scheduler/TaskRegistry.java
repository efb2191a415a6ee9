package com.example.summaryscheduler.service.scheduler;

import com.example.summaryscheduler.domain.entity.ScheduledTask;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory state owned by one scheduler: registered tasks, their pending
 * timers and the set of tasks currently executing.
 */
@Slf4j
@Component
public class TaskRegistry {

    private final Map<String, ScheduledTask> tasks = new ConcurrentHashMap<>();
    private final Map<String, ScheduledFuture<?>> triggers = new ConcurrentHashMap<>();
    private final Set<String> executing = ConcurrentHashMap.newKeySet();
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public void register(ScheduledTask task) {
        tasks.put(task.getId(), task);
    }

    public Optional<ScheduledTask> get(String taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    public boolean contains(String taskId) {
        return tasks.containsKey(taskId);
    }

    /**
     * Unregister a task and cancel its pending timer
     */
    public Optional<ScheduledTask> remove(String taskId) {
        cancelTrigger(taskId);
        return Optional.ofNullable(tasks.remove(taskId));
    }

    public Collection<ScheduledTask> all() {
        return List.copyOf(tasks.values());
    }

    public int size() {
        return tasks.size();
    }

    public long activeCount() {
        return tasks.values().stream().filter(ScheduledTask::isActive).count();
    }

    public long disabledCount() {
        return tasks.values().stream().filter(ScheduledTask::isDisabled).count();
    }

    /**
     * Replace the task's timer, cancelling the previous one
     */
    public void setTrigger(String taskId, ScheduledFuture<?> trigger) {
        var previous = triggers.put(taskId, trigger);
        if (previous != null && previous != trigger) {
            previous.cancel(false);
        }
    }

    public boolean hasTrigger(String taskId) {
        var trigger = triggers.get(taskId);
        return trigger != null && !trigger.isDone();
    }

    public void cancelTrigger(String taskId) {
        var trigger = triggers.remove(taskId);
        if (trigger != null) {
            trigger.cancel(false);
        }
    }

    public int cancelAllTriggers() {
        var count = 0;
        for (var taskId : List.copyOf(triggers.keySet())) {
            cancelTrigger(taskId);
            count++;
        }
        return count;
    }

    public long triggerCount() {
        return triggers.values().stream().filter(trigger -> !trigger.isDone()).count();
    }

    /**
     * Claim a task for execution
     *
     * @return false if the task is already executing
     */
    public boolean tryMarkExecuting(String taskId) {
        return executing.add(taskId);
    }

    public void finishExecuting(String taskId) {
        executing.remove(taskId);
    }

    public boolean isExecuting(String taskId) {
        return executing.contains(taskId);
    }

    public int executingCount() {
        return executing.size();
    }

    /**
     * Lock guarding state changes of one task
     */
    public ReentrantLock lockFor(String taskId) {
        return locks.computeIfAbsent(taskId, id -> new ReentrantLock());
    }

    /**
     * Drop the task's lock entry unless another thread holds or waits for it
     */
    public void discardLock(String taskId) {
        locks.computeIfPresent(taskId, (id, lock) -> lock.isLocked() || lock.hasQueuedThreads() ? lock : null);
    }

    int lockCount() {
        return locks.size();
    }

    public void clear() {
        cancelAllTriggers();
        tasks.clear();
        executing.clear();
        log.debug("Task registry cleared");
    }
}
