package com.example.summaryscheduler.domain.entity;

import com.example.summaryscheduler.domain.enums.DestinationType;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Result of delivering one artifact to one destination.
 */
@Value
@Builder
@Jacksonized
public class DeliveryOutcome {

    DestinationType destinationType;
    String target;
    boolean success;
    String message;
    Instant deliveredAt;

    public static DeliveryOutcome delivered(Destination destination, String message) {
        return DeliveryOutcome.builder()
                .destinationType(destination.getType())
                .target(destination.getTarget())
                .success(true)
                .message(message)
                .deliveredAt(Instant.now())
                .build();
    }

    public static DeliveryOutcome failed(Destination destination, String message) {
        return DeliveryOutcome.builder()
                .destinationType(destination.getType())
                .target(destination.getTarget())
                .success(false)
                .message(message)
                .build();
    }
}
