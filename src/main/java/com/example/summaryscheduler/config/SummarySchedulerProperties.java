package com.example.summaryscheduler.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the summary scheduler.
 * Loaded from application.yml.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "summary-scheduler")
public class SummarySchedulerProperties {

    /**
     * Directory holding one JSON record per task
     */
    @NotBlank
    private String storagePath = "./data/tasks";

    /**
     * Zone used to interpret times of day and cron expressions
     */
    @NotBlank
    private String zone = "UTC";

    /**
     * Start the scheduler together with the application context
     */
    private boolean autoStartup = true;

    /**
     * Threads firing timers
     */
    @Min(1)
    private int triggerPoolSize = 2;

    /**
     * Concurrent task executions
     */
    @Min(1)
    private int workerPoolSize = 8;

    /**
     * Due tasks waiting for a worker before dispatch is rejected
     */
    @Min(0)
    private int workerQueueCapacity = 100;

    /**
     * Threads running fetch and produce calls under a deadline
     */
    @Min(1)
    private int collaboratorPoolSize = 8;

    @NotNull
    private Duration fetchTimeout = Duration.ofMinutes(2);

    @NotNull
    private Duration produceTimeout = Duration.ofMinutes(5);

    /**
     * Upper bound for the exponential retry backoff
     */
    @NotNull
    private Duration maxRetryDelay = Duration.ofHours(6);

    /**
     * Whether runs with too little source content consume the failure budget
     */
    private boolean countInsufficientContentAsFailure = false;

    /**
     * Execution results kept per task
     */
    @Min(1)
    private int maxResultsPerTask = 50;

    /**
     * Upcoming fire times reported by stats
     */
    @Min(1)
    private int statsUpcomingCount = 5;

    /**
     * Days an inactive task or an execution result is retained
     */
    @Min(1)
    private int retentionDays = 30;

    @NotBlank
    private String cleanupCron = "0 0 3 * * *";

    /**
     * Directory that export and import files are resolved against
     */
    @NotBlank
    private String backupDir = "./data/backups";

    @Min(0)
    private int shutdownTimeoutSeconds = 30;
}
