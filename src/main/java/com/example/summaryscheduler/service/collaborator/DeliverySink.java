package com.example.summaryscheduler.service.collaborator;

import com.example.summaryscheduler.domain.entity.DeliveryOutcome;
import com.example.summaryscheduler.domain.entity.Destination;
import com.example.summaryscheduler.domain.entity.SummaryArtifact;
import com.example.summaryscheduler.domain.enums.DestinationType;

/**
 * Delivers an artifact to one kind of destination.
 * <p>
 * Implementations report failures through the returned outcome instead of throwing.
 */
public interface DeliverySink {

    DestinationType getDestinationType();

    DeliveryOutcome deliver(SummaryArtifact artifact, Destination destination);
}
