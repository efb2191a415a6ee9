package com.example.summaryscheduler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Summary Scheduler Application
 * <p>
 * Runs recurring summary tasks: each run fetches a window of source content,
 * has a summary produced from it and fans the result out to every destination
 * configured on the task.
 * <p>
 * Features:
 * - One-time, daily, weekly, monthly and cron recurrence
 * - File-backed task store with atomic writes
 * - Bounded retries with backoff, disabling tasks that keep failing
 * - Slack alerting for disabled tasks
 */
@EnableScheduling
@SpringBootApplication
public class SummarySchedulerApplication {

    public static void main(String[] args) {
        SpringApplication.run(SummarySchedulerApplication.class, args);
    }
}
