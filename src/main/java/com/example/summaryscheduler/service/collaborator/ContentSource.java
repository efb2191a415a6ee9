package com.example.summaryscheduler.service.collaborator;

import com.example.summaryscheduler.domain.entity.ContentItem;
import com.example.summaryscheduler.domain.entity.SummaryOptions;
import com.example.summaryscheduler.exception.ContentAccessException;

import java.time.Instant;
import java.util.List;

/**
 * Reads source content for a time window.
 */
public interface ContentSource {

    /**
     * Fetch items posted to {@code sourceRef} within {@code [start, end]}
     *
     * @throws ContentAccessException if the source is missing or cannot be read
     */
    List<ContentItem> fetch(String sourceRef, Instant start, Instant end, SummaryOptions options);
}
