package com.example.summaryscheduler.domain.repository;

import com.example.summaryscheduler.config.SummarySchedulerProperties;
import com.example.summaryscheduler.domain.entity.ScheduledTask;
import com.example.summaryscheduler.domain.entity.TaskExecutionResult;
import com.example.summaryscheduler.exception.TaskPersistenceException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * File backed {@link TaskStore}.
 * <p>
 * Layout under the storage directory:
 * <pre>
 *   &lt;id&gt;.json          task record
 *   results/&lt;id&gt;.json  execution history, oldest first
 * </pre>
 * Every write goes to a temp file in the same directory and is moved into place,
 * so a crash leaves either the old or the new record. Writes for one id are
 * serialized with a per-id lock; reads take no lock.
 * <p>
 * Exports carry each task together with its retained execution history.
 */
@Slf4j
@Repository
public class JsonFileTaskStore implements TaskStore {

    private static final String EXTENSION = ".json";
    private static final String RESULTS_DIR = "results";
    private static final TypeReference<List<TaskExecutionResult>> RESULT_LIST = new TypeReference<>() {
    };

    private final Path storageDir;
    private final Path resultsDir;
    private final int maxResultsPerTask;
    private final Clock clock;
    private final ObjectMapper objectMapper = createObjectMapper();
    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    @Autowired
    public JsonFileTaskStore(SummarySchedulerProperties properties, Clock clock) {
        this(Paths.get(properties.getStoragePath()), properties.getMaxResultsPerTask(), clock);
    }

    public JsonFileTaskStore(Path storageDir, int maxResultsPerTask, Clock clock) {
        this.storageDir = storageDir;
        this.resultsDir = storageDir.resolve(RESULTS_DIR);
        this.maxResultsPerTask = maxResultsPerTask;
        this.clock = clock;
        try {
            Files.createDirectories(resultsDir);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot create task storage directory " + storageDir.toAbsolutePath(), e);
        }
        log.info("Task store initialized at {}", storageDir.toAbsolutePath());
    }

    /**
     * Mapper used for task records and export documents
     */
    public static ObjectMapper createObjectMapper() {
        return JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT)
                .build();
    }

    @Override
    public void save(ScheduledTask task) {
        var taskId = requireValidId(task.getId());
        withLock(taskId, () -> {
            writeAtomically(taskFile(taskId), task, taskId);
            return null;
        });
        log.debug("Saved task {}", taskId);
    }

    @Override
    public Optional<ScheduledTask> load(String taskId) {
        if (!ScheduledTask.isValidId(taskId)) {
            return Optional.empty();
        }
        var file = taskFile(taskId);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        return readTask(file);
    }

    @Override
    public List<ScheduledTask> loadAll() {
        var tasks = new ArrayList<ScheduledTask>();
        try (Stream<Path> files = Files.list(storageDir)) {
            files.filter(this::isTaskFile)
                    .forEach(file -> readTask(file).ifPresent(tasks::add));
        } catch (IOException e) {
            log.error("Failed to list task storage directory {}: {}", storageDir, e.getMessage(), e);
            return List.of();
        }
        tasks.sort(Comparator.comparing(ScheduledTask::getCreatedAt, Comparator.nullsFirst(Comparator.naturalOrder())));
        log.debug("Loaded {} tasks from {}", tasks.size(), storageDir);
        return tasks;
    }

    @Override
    public boolean update(ScheduledTask task) {
        var taskId = requireValidId(task.getId());
        return withLock(taskId, () -> {
            var file = taskFile(taskId);
            if (!Files.exists(file)) {
                log.debug("Task {} no longer exists, skipping update", taskId);
                return false;
            }
            writeAtomically(file, task, taskId);
            return true;
        });
    }

    @Override
    public boolean delete(String taskId) {
        if (!ScheduledTask.isValidId(taskId)) {
            return false;
        }
        try {
            return withLock(taskId, () -> {
                try {
                    Files.deleteIfExists(resultsFile(taskId));
                    var removed = Files.deleteIfExists(taskFile(taskId));
                    if (removed) {
                        log.info("Deleted task {}", taskId);
                    }
                    return removed;
                } catch (IOException e) {
                    throw new TaskPersistenceException(taskId, e);
                }
            });
        } finally {
            evictLock(taskId);
        }
    }

    @Override
    public List<ScheduledTask> listBySource(String sourceRef) {
        return loadAll().stream()
                .filter(task -> sourceRef.equals(task.getSourceRef()) || sourceRef.equals(task.getSourceGroup()))
                .toList();
    }

    @Override
    public void saveResult(TaskExecutionResult result) {
        var taskId = requireValidId(result.getTaskId());
        withLock(taskId, () -> {
            var results = new ArrayList<>(readResults(taskId));
            results.add(result);
            writeResults(taskId, results);
            return null;
        });
    }

    @Override
    public List<TaskExecutionResult> loadResults(String taskId, int limit) {
        if (!ScheduledTask.isValidId(taskId) || limit <= 0) {
            return List.of();
        }
        var results = new ArrayList<>(readResults(taskId));
        var from = Math.max(0, results.size() - limit);
        var recent = new ArrayList<>(results.subList(from, results.size()));
        Collections.reverse(recent);
        return recent;
    }

    @Override
    public int cleanupOlderThan(int days) {
        var cutoff = clock.instant().minus(Duration.ofDays(days));
        var removed = 0;
        for (var task : loadAll()) {
            if (task.isActive()) {
                continue;
            }
            var inactiveSince = inactiveSince(task);
            if (inactiveSince != null && inactiveSince.isBefore(cutoff) && delete(task.getId())) {
                removed++;
            }
        }
        log.info("Cleaned up {} tasks inactive for more than {} days", removed, days);
        return removed;
    }

    @Override
    public int cleanupResultsOlderThan(Instant cutoff) {
        var removed = 0;
        try (Stream<Path> files = Files.list(resultsDir)) {
            for (var file : files.filter(this::isTaskFile).toList()) {
                var taskId = idOf(file);
                removed += withLock(taskId, () -> {
                    var results = readResults(taskId);
                    var kept = results.stream()
                            .filter(result -> result.getCompletedAt() == null || !result.getCompletedAt().isBefore(cutoff))
                            .toList();
                    if (kept.size() != results.size()) {
                        writeAtomically(file, kept, taskId);
                    }
                    return results.size() - kept.size();
                });
            }
        } catch (IOException e) {
            log.error("Failed to list results directory {}: {}", resultsDir, e.getMessage(), e);
        }
        log.info("Cleaned up {} execution results completed before {}", removed, cutoff);
        return removed;
    }

    @Override
    public boolean export(Path path) {
        var tasks = loadAll().stream()
                .map(task -> new ExportedTask(task, readResults(task.getId())))
                .toList();
        var document = new TaskExport(clock.instant(), tasks.size(), tasks);
        try {
            var parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(path.toFile(), document);
            log.info("Exported {} tasks to {}", tasks.size(), path);
            return true;
        } catch (IOException e) {
            log.error("Failed to export tasks to {}: {}", path, e.getMessage(), e);
            return false;
        }
    }

    @Override
    public int importFrom(Path path, Consumer<ScheduledTask> validator) {
        TaskExport document;
        try {
            document = objectMapper.readValue(path.toFile(), TaskExport.class);
        } catch (IOException e) {
            log.error("Failed to read import file {}: {}", path, e.getMessage());
            return 0;
        }
        if (document.getTasks() == null) {
            log.warn("Import file {} contains no tasks", path);
            return 0;
        }

        var imported = 0;
        for (var entry : document.getTasks()) {
            var task = entry != null ? entry.getTask() : null;
            try {
                if (task == null) {
                    continue;
                }
                task.validateRequiredFields();
                validator.accept(task);
                save(task);
                if (entry.getRecentResults() != null) {
                    withLock(task.getId(), () -> {
                        writeResults(task.getId(), new ArrayList<>(entry.getRecentResults()));
                        return null;
                    });
                }
                imported++;
            } catch (RuntimeException e) {
                log.warn("Skipping task {} from import: {}", task != null ? task.getId() : null, e.getMessage());
            }
        }
        log.info("Imported {} of {} tasks from {}", imported, document.getTasks().size(), path);
        return imported;
    }

    private Optional<ScheduledTask> readTask(Path file) {
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), ScheduledTask.class));
        } catch (IOException e) {
            log.warn("Skipping corrupt task record {}: {}", file.getFileName(), e.getMessage());
            return Optional.empty();
        }
    }

    private List<TaskExecutionResult> readResults(String taskId) {
        var file = resultsFile(taskId);
        if (!Files.exists(file)) {
            return List.of();
        }
        try {
            return objectMapper.readValue(file.toFile(), RESULT_LIST);
        } catch (IOException e) {
            log.warn("Discarding corrupt execution history for task {}: {}", taskId, e.getMessage());
            return List.of();
        }
    }

    /**
     * Replace the task's history, keeping the most recent entries. Caller holds the task lock.
     */
    private void writeResults(String taskId, List<TaskExecutionResult> results) {
        if (results.size() > maxResultsPerTask) {
            results.subList(0, results.size() - maxResultsPerTask).clear();
        }
        writeAtomically(resultsFile(taskId), results, taskId);
    }

    /**
     * Pause, disable and completion all stamp {@code updatedAt}
     */
    private Instant inactiveSince(ScheduledTask task) {
        if (task.getUpdatedAt() != null) {
            return task.getUpdatedAt();
        }
        return task.getLastRun() != null ? task.getLastRun() : task.getCreatedAt();
    }

    private void writeAtomically(Path target, Object value, String taskId) {
        Path temp = null;
        try {
            temp = Files.createTempFile(target.getParent(), "." + taskId + "-", ".tmp");
            objectMapper.writeValue(temp.toFile(), value);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new TaskPersistenceException(taskId, e);
        }
    }

    private void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not remove temp file {}: {}", temp, e.getMessage());
        }
    }

    private <T> T withLock(String taskId, Supplier<T> action) {
        var lock = locks.computeIfAbsent(taskId, id -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private void evictLock(String taskId) {
        locks.computeIfPresent(taskId, (id, lock) -> lock.isLocked() || lock.hasQueuedThreads() ? lock : null);
    }

    int lockCount() {
        return locks.size();
    }

    private boolean isTaskFile(Path file) {
        var name = file.getFileName().toString();
        return Files.isRegularFile(file) && name.endsWith(EXTENSION) && ScheduledTask.isValidId(idOf(file));
    }

    private String idOf(Path file) {
        var name = file.getFileName().toString();
        return name.substring(0, name.length() - EXTENSION.length());
    }

    private Path taskFile(String taskId) {
        return storageDir.resolve(taskId + EXTENSION);
    }

    private Path resultsFile(String taskId) {
        return resultsDir.resolve(taskId + EXTENSION);
    }

    private String requireValidId(String taskId) {
        if (!ScheduledTask.isValidId(taskId)) {
            throw new IllegalArgumentException("Invalid task id: " + taskId);
        }
        return taskId;
    }

    /**
     * Export document: {@code export_date}, {@code task_count}, {@code tasks}
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TaskExport {
        private Instant exportDate;
        private int taskCount;
        private List<ExportedTask> tasks;
    }

    /**
     * One exported task: the task record fields plus {@code recent_results}, oldest first
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ExportedTask {
        @JsonUnwrapped
        private ScheduledTask task;
        private List<TaskExecutionResult> recentResults;
    }
}
