package com.example.summaryscheduler.service.collaborator;

import com.example.summaryscheduler.domain.entity.ContentItem;
import com.example.summaryscheduler.domain.entity.ScheduledTask;

import java.util.List;

/**
 * Turns fetched content into a summary artifact.
 * <p>
 * Declining to summarize thin input is an expected outcome and is returned as
 * {@link ProductionResult#insufficientContent(String)}, not thrown.
 */
public interface ArtifactProducer {

    ProductionResult produce(ScheduledTask task, List<ContentItem> items);
}
