package com.example.summaryscheduler.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Scheduler statistics response
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SchedulerStats {

    private boolean running;
    private long totalTasks;
    private long activeTasks;
    private long pausedTasks;
    private long disabledTasks;
    private long scheduledTriggers;
    private long executingTasks;
    private List<UpcomingRun> nextRunTimes;
    private Instant generatedAt;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class UpcomingRun {
        private String taskId;
        private String name;
        private Instant nextRun;
    }
}
