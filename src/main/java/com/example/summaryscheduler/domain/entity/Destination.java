package com.example.summaryscheduler.domain.entity;

import com.example.summaryscheduler.domain.enums.DestinationType;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A single delivery target for a task's summary.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Destination {

    DestinationType type;

    /**
     * Channel id, webhook URL, email address or file path depending on {@link #type}
     */
    String target;

    /**
     * Rendering format: embed, markdown, json or plain
     */
    @Builder.Default
    String format = "markdown";

    @Builder.Default
    boolean enabled = true;

    public String describe() {
        return type + ":" + target;
    }
}
