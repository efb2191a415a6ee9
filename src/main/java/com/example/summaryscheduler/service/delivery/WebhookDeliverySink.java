package com.example.summaryscheduler.service.delivery;

import com.example.summaryscheduler.domain.entity.DeliveryOutcome;
import com.example.summaryscheduler.domain.entity.Destination;
import com.example.summaryscheduler.domain.entity.SummaryArtifact;
import com.example.summaryscheduler.domain.enums.DestinationType;
import com.example.summaryscheduler.service.collaborator.DeliverySink;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * POSTs summaries as JSON to an arbitrary webhook URL.
 */
@Slf4j
@Component
public class WebhookDeliverySink implements DeliverySink {

    private static final Duration TIMEOUT = Duration.ofSeconds(30);

    private final WebClient webClient;
    private final ArtifactFormatter formatter;

    public WebhookDeliverySink(@Qualifier("webhookWebClient") WebClient webClient, ArtifactFormatter formatter) {
        this.webClient = webClient;
        this.formatter = formatter;
    }

    @Override
    public DestinationType getDestinationType() {
        return DestinationType.WEBHOOK;
    }

    @Override
    public DeliveryOutcome deliver(SummaryArtifact artifact, Destination destination) {
        try {
            var response = webClient.post()
                    .uri(destination.getTarget())
                    .bodyValue(buildPayload(artifact, destination))
                    .retrieve()
                    .toBodilessEntity()
                    .timeout(TIMEOUT)
                    .block();

            var status = response != null ? response.getStatusCode().value() : 0;
            log.info("Delivered summary {} to webhook {} (HTTP {})", artifact.getId(), destination.getTarget(), status);
            return DeliveryOutcome.delivered(destination, "HTTP " + status);
        } catch (WebClientResponseException e) {
            log.warn("Webhook {} rejected summary {}: HTTP {}", destination.getTarget(), artifact.getId(), e.getStatusCode().value());
            return DeliveryOutcome.failed(destination, "HTTP " + e.getStatusCode().value() + ": " + e.getResponseBodyAsString());
        } catch (Exception e) {
            log.error("Error delivering summary {} to webhook {}: {}", artifact.getId(), destination.getTarget(), e.getMessage());
            return DeliveryOutcome.failed(destination, e.getMessage());
        }
    }

    private Map<String, Object> buildPayload(SummaryArtifact artifact, Destination destination) {
        var payload = new LinkedHashMap<String, Object>();
        payload.put("summary_id", artifact.getId());
        payload.put("task_id", artifact.getTaskId());
        payload.put("source_ref", artifact.getSourceRef());
        payload.put("title", artifact.getTitle());
        payload.put("content", formatter.render(artifact, destination.getFormat()));
        payload.put("key_points", artifact.getKeyPoints());
        payload.put("action_items", artifact.getActionItems());
        payload.put("message_count", artifact.getItemCount());
        payload.put("created_at", artifact.getCreatedAt() != null ? artifact.getCreatedAt().toString() : null);
        return payload;
    }
}
