package com.example.summaryscheduler.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools used by the scheduler.
 * <p>
 * Timers fire on a small scheduler pool and only hand work over to the bounded
 * worker pool, so a slow run never delays another task's trigger.
 */
@Slf4j
@EnableAsync
@Configuration
public class AsyncConfig {

    /**
     * Timer pool. Also picked up by {@code @Scheduled} housekeeping jobs.
     */
    @Bean(name = "triggerScheduler")
    public ThreadPoolTaskScheduler triggerScheduler(SummarySchedulerProperties properties) {
        log.info("Creating trigger scheduler with {} threads", properties.getTriggerPoolSize());

        var scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(properties.getTriggerPoolSize());
        scheduler.setThreadNamePrefix("summary-trigger-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    /**
     * Bounded pool running task executions.
     */
    @Bean(name = "taskWorkerExecutor")
    public ThreadPoolTaskExecutor taskWorkerExecutor(SummarySchedulerProperties properties) {
        log.info("Creating task worker pool with max {} concurrent runs", properties.getWorkerPoolSize());

        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getWorkerPoolSize());
        executor.setMaxPoolSize(properties.getWorkerPoolSize());
        executor.setQueueCapacity(properties.getWorkerQueueCapacity());
        executor.setThreadNamePrefix("summary-worker-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(properties.getShutdownTimeoutSeconds());
        return executor;
    }

    /**
     * Pool for content fetch and summary production calls, so a run can give up
     * waiting once its deadline passes.
     */
    @Bean(name = "collaboratorExecutor")
    public ThreadPoolTaskExecutor collaboratorExecutor(SummarySchedulerProperties properties) {
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getCollaboratorPoolSize());
        executor.setMaxPoolSize(properties.getCollaboratorPoolSize());
        executor.setQueueCapacity(properties.getWorkerQueueCapacity());
        executor.setThreadNamePrefix("summary-io-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }

    /**
     * Task executor for Spring's @Async annotation (alerts).
     */
    @Bean(name = "taskExecutor")
    public TaskExecutor taskExecutor() {
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("async-alert-");
        executor.setRejectedExecutionHandler((r, e) -> {
            log.warn("Task rejected from async executor, running in caller thread");
            if (!e.isShutdown()) {
                r.run();
            }
        });
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
