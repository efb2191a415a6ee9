package com.example.summaryscheduler.service.collaborator;

import com.example.summaryscheduler.domain.entity.SummaryArtifact;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Either a produced artifact or the reason nothing could be produced.
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class ProductionResult {

    private final SummaryArtifact artifact;
    private final String insufficientReason;

    public static ProductionResult produced(SummaryArtifact artifact) {
        if (artifact == null) {
            throw new IllegalArgumentException("Produced artifact must not be null");
        }
        return new ProductionResult(artifact, null);
    }

    public static ProductionResult insufficientContent(String reason) {
        return new ProductionResult(null, reason != null ? reason : "Insufficient content");
    }

    public boolean isProduced() {
        return artifact != null;
    }
}
