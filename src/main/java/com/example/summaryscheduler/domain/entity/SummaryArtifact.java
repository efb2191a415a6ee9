package com.example.summaryscheduler.domain.entity;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * The produced summary that is fanned out to destinations.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class SummaryArtifact {

    String id;
    String taskId;
    String sourceRef;
    String title;
    String summaryText;

    @Builder.Default
    List<String> keyPoints = List.of();

    @Builder.Default
    List<String> actionItems = List.of();

    @Builder.Default
    List<String> participants = List.of();

    int itemCount;
    Instant windowStart;
    Instant windowEnd;
    Instant createdAt;

    @Builder.Default
    Map<String, Object> metadata = Map.of();
}
