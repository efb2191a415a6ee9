package com.example.summaryscheduler.domain.repository;

import com.example.summaryscheduler.domain.entity.ScheduledTask;
import com.example.summaryscheduler.domain.entity.TaskExecutionResult;
import com.example.summaryscheduler.exception.TaskPersistenceException;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Durable storage for tasks and their execution history.
 * <p>
 * Writes for the same task id are serialized and atomic: a reader never sees a
 * partially written record. Unreadable records are skipped, never fatal.
 */
public interface TaskStore {

    /**
     * Create or overwrite a task record
     *
     * @throws TaskPersistenceException if the record cannot be written
     */
    void save(ScheduledTask task);

    Optional<ScheduledTask> load(String taskId);

    /**
     * All readable task records, oldest first
     */
    List<ScheduledTask> loadAll();

    /**
     * Overwrite an existing task record
     *
     * @return false if the record no longer exists, in which case nothing is written
     * @throws TaskPersistenceException if the record cannot be written
     */
    boolean update(ScheduledTask task);

    /**
     * Remove a task and its execution history
     *
     * @return true if a task record was removed
     */
    boolean delete(String taskId);

    /**
     * Tasks whose source reference or source group equals {@code sourceRef}
     */
    List<ScheduledTask> listBySource(String sourceRef);

    /**
     * Append an execution result to the task's bounded history
     */
    void saveResult(TaskExecutionResult result);

    /**
     * Most recent results first
     */
    List<TaskExecutionResult> loadResults(String taskId, int limit);

    /**
     * Remove tasks that have been inactive for longer than {@code days}
     *
     * @return number of tasks removed
     */
    int cleanupOlderThan(int days);

    /**
     * Remove execution results completed before {@code cutoff}
     *
     * @return number of results removed
     */
    int cleanupResultsOlderThan(Instant cutoff);

    /**
     * Write every task to a single export document
     *
     * @return true if the export was written
     */
    boolean export(Path path);

    /**
     * Import tasks and their history from an export document. Each record is applied independently.
     *
     * @return number of tasks imported, 0 if the document is unreadable
     */
    default int importFrom(Path path) {
        return importFrom(path, task -> {
        });
    }

    /**
     * Import tasks, skipping records the validator rejects with a runtime exception
     *
     * @return number of tasks imported, 0 if the document is unreadable
     */
    int importFrom(Path path, Consumer<ScheduledTask> validator);
}
