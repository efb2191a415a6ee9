package com.example.summaryscheduler.domain.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * Options handed to the content source and the artifact producer.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SummaryOptions {

    /**
     * brief, detailed or comprehensive
     */
    @Builder.Default
    private String summaryLength = "detailed";

    private String model;

    @Builder.Default
    private double temperature = 0.3;

    @Builder.Default
    private int maxTokens = 4000;

    @Builder.Default
    private boolean includeBots = false;

    @Builder.Default
    private boolean includeAttachments = true;

    /**
     * Minimum number of source items needed to produce a summary
     */
    @Builder.Default
    private int minItems = 5;

    /**
     * Width of the content window ending at execution time
     */
    @Builder.Default
    private int timeRangeHours = 24;

    @Builder.Default
    private Map<String, Object> extra = new HashMap<>();

    public static SummaryOptions defaults() {
        return SummaryOptions.builder().build();
    }
}
