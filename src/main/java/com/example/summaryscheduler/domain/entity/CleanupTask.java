package com.example.summaryscheduler.domain.entity;

import lombok.Builder;
import lombok.Value;

/**
 * Housekeeping run that purges old execution results and inactive tasks.
 */
@Value
@Builder
public class CleanupTask {

    @Builder.Default
    String id = "retention-cleanup";

    int retentionDays;
}
