package com.example.summaryscheduler.exception;

import lombok.Getter;

/**
 * Exception for task records that could not be written or removed
 */
@Getter
public class TaskPersistenceException extends RuntimeException {

    private final String taskId;

    public TaskPersistenceException(String taskId, Throwable cause) {
        super("Failed to persist task " + taskId + ": " + cause.getMessage(), cause);
        this.taskId = taskId;
    }

    public TaskPersistenceException(String taskId, String message) {
        super("Failed to persist task " + taskId + ": " + message);
        this.taskId = taskId;
    }
}
