package com.example.summaryscheduler.controller;

import com.example.summaryscheduler.domain.entity.ScheduledTask;
import com.example.summaryscheduler.dto.ApiResponse;
import com.example.summaryscheduler.dto.CreateTaskRequest;
import com.example.summaryscheduler.dto.ExecutionResultResponse;
import com.example.summaryscheduler.dto.SchedulerStats;
import com.example.summaryscheduler.dto.TaskResponse;
import com.example.summaryscheduler.dto.TaskStatusSnapshot;
import com.example.summaryscheduler.exception.TaskNotFoundException;
import com.example.summaryscheduler.mapper.TaskMapper;
import com.example.summaryscheduler.service.recurrence.RecurrenceCalculator;
import com.example.summaryscheduler.service.scheduler.TaskSchedulerService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST API controller for summary task management.
 * <p>
 * Provides endpoints for:
 * - Scheduling tasks
 * - Task details, status and execution history
 * - Pause, resume, cancel and manual runs
 * - Scheduler statistics, export and import
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/tasks")
@Tag(name = "Summary Tasks", description = "APIs for managing scheduled summary tasks")
public class TaskController {

    private final TaskSchedulerService schedulerService;
    private final RecurrenceCalculator recurrenceCalculator;
    private final TaskMapper taskMapper;

    // === Task Creation ===

    @PostMapping
    @Operation(summary = "Schedule a task", description = "Validate, persist and arm a new summary task")
    public ResponseEntity<ApiResponse<TaskResponse>> createTask(@Valid @RequestBody CreateTaskRequest request) {
        log.info("API: Schedule {} task '{}' for source {}", request.getScheduleType(), request.getName(), request.getSourceRef());

        var taskId = schedulerService.schedule(taskMapper.toTask(request));
        var task = schedulerService.getTask(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(toResponse(task), "Task scheduled successfully"));
    }

    // === Task Retrieval ===

    @GetMapping
    @Operation(summary = "List tasks", description = "List registered tasks, optionally for one source or source group")
    public ResponseEntity<ApiResponse<List<TaskResponse>>> listTasks(
            @Parameter(description = "Source reference or source group filter") @RequestParam(required = false) String sourceRef) {

        var tasks = schedulerService.getScheduledTasks(sourceRef).stream().map(this::toResponse).toList();
        return ResponseEntity.ok(ApiResponse.success(tasks));
    }

    @GetMapping("/{taskId}")
    @Operation(summary = "Get task by ID", description = "Retrieve a task by its identifier")
    public ResponseEntity<ApiResponse<TaskResponse>> getTask(@Parameter(description = "Task id") @PathVariable String taskId) {
        return schedulerService.getTask(taskId)
                .map(task -> ResponseEntity.ok(ApiResponse.success(toResponse(task))))
                .orElseThrow(() -> new TaskNotFoundException(taskId));
    }

    @GetMapping("/{taskId}/status")
    @Operation(summary = "Get task status", description = "Counters, last error and next run of a task")
    public ResponseEntity<ApiResponse<TaskStatusSnapshot>> getStatus(@Parameter(description = "Task id") @PathVariable String taskId) {
        return schedulerService.status(taskId)
                .map(status -> ResponseEntity.ok(ApiResponse.success(status)))
                .orElseThrow(() -> new TaskNotFoundException(taskId));
    }

    @GetMapping("/{taskId}/history")
    @Operation(summary = "Get execution history", description = "Most recent executions of a task, newest first")
    public ResponseEntity<ApiResponse<List<ExecutionResultResponse>>> getHistory(
            @Parameter(description = "Task id") @PathVariable String taskId,
            @Parameter(description = "Maximum number of results") @RequestParam(defaultValue = "20") int limit) {

        var results = schedulerService.getExecutionHistory(taskId, limit);
        return ResponseEntity.ok(ApiResponse.success(taskMapper.toResultResponses(results)));
    }

    // === Task State Management ===

    @PostMapping("/{taskId}/pause")
    @Operation(summary = "Pause a task", description = "Stop a task from firing until it is resumed")
    public ResponseEntity<ApiResponse<TaskResponse>> pauseTask(@Parameter(description = "Task id") @PathVariable String taskId) {
        log.info("API: Pause task {}", taskId);

        if (!schedulerService.pause(taskId)) {
            throw new TaskNotFoundException(taskId);
        }
        return ResponseEntity.ok(ApiResponse.success(currentResponse(taskId), "Task paused successfully"));
    }

    @PostMapping("/{taskId}/resume")
    @Operation(summary = "Resume a task", description = "Reactivate a paused or disabled task")
    public ResponseEntity<ApiResponse<TaskResponse>> resumeTask(
            @Parameter(description = "Task id") @PathVariable String taskId,
            @Parameter(description = "Clear the failure count") @RequestParam(defaultValue = "false") boolean resetFailures) {
        log.info("API: Resume task {} (reset failures: {})", taskId, resetFailures);

        if (schedulerService.getTask(taskId).isEmpty()) {
            throw new TaskNotFoundException(taskId);
        }
        if (!schedulerService.resume(taskId, resetFailures)) {
            throw new IllegalStateException("Task has no further runs: " + taskId);
        }
        return ResponseEntity.ok(ApiResponse.success(currentResponse(taskId), "Task resumed successfully"));
    }

    @DeleteMapping("/{taskId}")
    @Operation(summary = "Cancel a task", description = "Remove a task and its persisted record")
    public ResponseEntity<ApiResponse<Boolean>> cancelTask(@Parameter(description = "Task id") @PathVariable String taskId) {
        log.info("API: Cancel task {}", taskId);

        if (!schedulerService.cancel(taskId)) {
            throw new TaskNotFoundException(taskId);
        }
        return ResponseEntity.ok(ApiResponse.success(true, "Task cancelled successfully"));
    }

    @PostMapping("/{taskId}/run")
    @Operation(summary = "Run a task now", description = "Execute a task immediately and wait for the result")
    public ResponseEntity<ApiResponse<ExecutionResultResponse>> runTask(@Parameter(description = "Task id") @PathVariable String taskId) {
        log.info("API: Run task {} now", taskId);

        var result = schedulerService.triggerNow(taskId).join();
        var message = result.isSuccess() ? "Task executed" : "Task execution failed";
        return ResponseEntity.ok(ApiResponse.success(taskMapper.toResultResponse(result), message));
    }

    // === Statistics ===

    @GetMapping("/stats")
    @Operation(summary = "Get scheduler statistics", description = "Running flag, task counts and upcoming runs")
    public ResponseEntity<ApiResponse<SchedulerStats>> getStats(
            @Parameter(description = "Number of upcoming runs to list") @RequestParam(required = false) Integer upcoming) {

        var stats = upcoming != null ? schedulerService.stats(upcoming) : schedulerService.stats();
        return ResponseEntity.ok(ApiResponse.success(stats));
    }

    // === Backup ===

    @PostMapping("/export")
    @Operation(summary = "Export tasks", description = "Write every stored task and its history to a file in the backup directory")
    public ResponseEntity<ApiResponse<Boolean>> exportTasks(
            @Parameter(description = "File name relative to the backup directory") @RequestParam String file) {
        log.info("API: Export tasks to {}", file);

        if (!schedulerService.exportTasks(schedulerService.resolveBackupFile(file))) {
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ApiResponse.error("Export failed"));
        }
        return ResponseEntity.ok(ApiResponse.success(true, "Tasks exported"));
    }

    @PostMapping("/import")
    @Operation(summary = "Import tasks", description = "Load tasks from an export file in the backup directory")
    public ResponseEntity<ApiResponse<Integer>> importTasks(
            @Parameter(description = "File name relative to the backup directory") @RequestParam String file) {
        log.info("API: Import tasks from {}", file);

        var imported = schedulerService.importTasks(schedulerService.resolveBackupFile(file));
        return ResponseEntity.ok(ApiResponse.success(imported, String.format("Imported %d tasks", imported)));
    }

    private TaskResponse currentResponse(String taskId) {
        return schedulerService.getTask(taskId).map(this::toResponse).orElseThrow(() -> new TaskNotFoundException(taskId));
    }

    private TaskResponse toResponse(ScheduledTask task) {
        var response = taskMapper.toResponse(task);
        response.setSchedule(recurrenceCalculator.describe(task.getRecurrence()));
        return response;
    }
}
