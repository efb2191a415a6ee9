package com.example.summaryscheduler.domain.entity;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * One unit of source content, e.g. a chat message.
 */
@Value
@Builder
@Jacksonized
public class ContentItem {

    String id;
    String author;
    String content;
    Instant timestamp;
    boolean bot;
    int attachmentCount;
}
