package com.example.summaryscheduler.client;

import com.example.summaryscheduler.domain.entity.ContentItem;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Request/Response DTOs for external service clients
 */
public class ClientModels {
    private ClientModels() {
    }

    // === Content Service Models ===

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ContentPage {
        private String sourceRef;
        private List<ContentItem> items;
        private boolean truncated;
    }

    // === Summary Service Models ===

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SummaryRequest {
        private String taskId;
        private String sourceRef;
        private String summaryLength;
        private String model;
        private double temperature;
        private int maxTokens;
        private boolean includeAttachments;
        private List<ContentItem> items;
        private Map<String, Object> extra;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SummaryResponse {
        private String id;
        private String title;
        private String summaryText;
        private List<String> keyPoints;
        private List<String> actionItems;
        private List<String> participants;
        private Map<String, Object> metadata;
    }
}
