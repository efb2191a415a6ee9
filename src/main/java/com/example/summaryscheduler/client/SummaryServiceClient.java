package com.example.summaryscheduler.client;

import com.example.summaryscheduler.client.ClientModels.SummaryRequest;
import com.example.summaryscheduler.client.ClientModels.SummaryResponse;
import com.example.summaryscheduler.config.SummaryServiceProperties;
import com.example.summaryscheduler.domain.entity.ContentItem;
import com.example.summaryscheduler.domain.entity.ScheduledTask;
import com.example.summaryscheduler.domain.entity.SummaryArtifact;
import com.example.summaryscheduler.exception.ExternalServiceException;
import com.example.summaryscheduler.service.collaborator.ArtifactProducer;
import com.example.summaryscheduler.service.collaborator.ProductionResult;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Client for the summary service that turns messages into a summary.
 * <p>
 * An HTTP 422 answer means the service judged the input too thin to summarize
 * and is returned as an insufficient-content result.
 */
@Slf4j
@Component
public class SummaryServiceClient implements ArtifactProducer {

    private static final String SERVICE_NAME = "Summary Service";

    private final WebClient webClient;
    private final SummaryServiceProperties properties;

    public SummaryServiceClient(@Qualifier("summaryServiceWebClient") WebClient webClient, SummaryServiceProperties properties) {
        this.webClient = webClient;
        this.properties = properties;
    }

    @Override
    @CircuitBreaker(name = "summaryService", fallbackMethod = "produceFallback")
    @Retry(name = "summaryService")
    public ProductionResult produce(ScheduledTask task, List<ContentItem> items) {
        log.info("Requesting summary for task {} from {} items", task.getId(), items.size());

        var options = task.getSummaryOptions();
        var request = SummaryRequest.builder()
                .taskId(task.getId())
                .sourceRef(task.getSourceRef())
                .summaryLength(options.getSummaryLength())
                .model(options.getModel())
                .temperature(options.getTemperature())
                .maxTokens(options.getMaxTokens())
                .includeAttachments(options.isIncludeAttachments())
                .items(items)
                .extra(options.getExtra())
                .build();

        try {
            var response = webClient.post()
                    .uri("/api/v1/summaries")
                    .bodyValue(request)
                    .retrieve()
                    .onStatus(status -> status.isError() && status.value() != HttpStatus.UNPROCESSABLE_ENTITY.value(), clientResponse ->
                            clientResponse.bodyToMono(String.class)
                                    .defaultIfEmpty("")
                                    .flatMap(body -> Mono.error(
                                            new ExternalServiceException(SERVICE_NAME, clientResponse.statusCode().value(), body))))
                    .bodyToMono(SummaryResponse.class)
                    .timeout(Duration.ofSeconds(properties.getTimeoutSeconds()))
                    .block();

            if (response == null) {
                throw new ExternalServiceException(SERVICE_NAME, "Empty response body", null);
            }
            return ProductionResult.produced(toArtifact(task, items, response));
        } catch (WebClientResponseException e) {
            if (e.getStatusCode().value() == HttpStatus.UNPROCESSABLE_ENTITY.value()) {
                log.info("Summary service declined task {}: {}", task.getId(), e.getResponseBodyAsString());
                return ProductionResult.insufficientContent(e.getResponseBodyAsString());
            }
            throw new ExternalServiceException(SERVICE_NAME, e);
        } catch (ExternalServiceException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to produce summary for task {}: {}", task.getId(), e.getMessage());
            throw new ExternalServiceException(SERVICE_NAME, e);
        }
    }

    /**
     * Fallback method when circuit breaker is open
     */
    @SuppressWarnings("unused")
    private ProductionResult produceFallback(ScheduledTask task, List<ContentItem> items, CallNotPermittedException e) {
        log.warn("Circuit breaker open for {}, task: {}", SERVICE_NAME, task.getId());
        throw new ExternalServiceException(SERVICE_NAME, "Service temporarily unavailable (circuit breaker open)", e);
    }

    private SummaryArtifact toArtifact(ScheduledTask task, List<ContentItem> items, SummaryResponse response) {
        return SummaryArtifact.builder()
                .id(response.getId() != null ? response.getId() : UUID.randomUUID().toString())
                .taskId(task.getId())
                .sourceRef(task.getSourceRef())
                .title(response.getTitle())
                .summaryText(response.getSummaryText())
                .keyPoints(response.getKeyPoints() != null ? response.getKeyPoints() : List.of())
                .actionItems(response.getActionItems() != null ? response.getActionItems() : List.of())
                .participants(response.getParticipants() != null ? response.getParticipants() : List.of())
                .itemCount(items.size())
                .createdAt(Instant.now())
                .metadata(response.getMetadata() != null ? response.getMetadata() : Map.of())
                .build();
    }
}
