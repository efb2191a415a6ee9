package com.example.summaryscheduler.exception;

/**
 * Exception for operations that need a started scheduler
 */
public class SchedulerNotRunningException extends RuntimeException {

    public SchedulerNotRunningException(String operation) {
        super("Scheduler is not running, cannot " + operation);
    }
}
