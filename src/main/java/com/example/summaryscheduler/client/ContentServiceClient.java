package com.example.summaryscheduler.client;

import com.example.summaryscheduler.client.ClientModels.ContentPage;
import com.example.summaryscheduler.config.ContentServiceProperties;
import com.example.summaryscheduler.domain.entity.ContentItem;
import com.example.summaryscheduler.domain.entity.SummaryOptions;
import com.example.summaryscheduler.exception.ContentAccessException;
import com.example.summaryscheduler.exception.ExternalServiceException;
import com.example.summaryscheduler.service.collaborator.ContentSource;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Client for the content service that exposes channel history.
 * <p>
 * Uses:
 * - Resilience4j Circuit Breaker for fault tolerance
 * - Retry with exponential backoff for transient errors
 * - WebClient for HTTP calls
 */
@Slf4j
@Component
public class ContentServiceClient implements ContentSource {

    private static final String SERVICE_NAME = "Content Service";

    private final WebClient webClient;
    private final ContentServiceProperties properties;

    public ContentServiceClient(@Qualifier("contentServiceWebClient") WebClient webClient, ContentServiceProperties properties) {
        this.webClient = webClient;
        this.properties = properties;
    }

    /**
     * Fetch messages of a channel within a window
     *
     * @throws ContentAccessException   if the channel is missing or not readable
     * @throws ExternalServiceException if the service call fails
     */
    @Override
    @CircuitBreaker(name = "contentService", fallbackMethod = "fetchFallback")
    @Retry(name = "contentService")
    public List<ContentItem> fetch(String sourceRef, Instant start, Instant end, SummaryOptions options) {
        log.debug("Fetching content for {} between {} and {}", sourceRef, start, end);

        try {
            var page = webClient.get()
                    .uri(uriBuilder -> uriBuilder
                            .path("/api/v1/channels/{sourceRef}/messages")
                            .queryParam("start", start.toString())
                            .queryParam("end", end.toString())
                            .queryParam("limit", properties.getMaxItems())
                            .queryParam("includeBots", options.isIncludeBots())
                            .build(sourceRef))
                    .retrieve()
                    .onStatus(status -> status.value() == HttpStatus.FORBIDDEN.value(), response ->
                            Mono.error(new ContentAccessException(sourceRef, ContentAccessException.Reason.ACCESS_DENIED,
                                    "No permission to read channel")))
                    .onStatus(status -> status.value() == HttpStatus.NOT_FOUND.value(), response ->
                            Mono.error(new ContentAccessException(sourceRef, ContentAccessException.Reason.NOT_FOUND,
                                    "Channel not found")))
                    .onStatus(HttpStatusCode::isError, response ->
                            response.bodyToMono(String.class)
                                    .defaultIfEmpty("")
                                    .flatMap(body -> Mono.error(
                                            new ExternalServiceException(SERVICE_NAME, response.statusCode().value(), body))))
                    .bodyToMono(ContentPage.class)
                    .timeout(Duration.ofSeconds(properties.getTimeoutSeconds()))
                    .block();

            if (page == null || page.getItems() == null) {
                return List.of();
            }
            if (page.isTruncated()) {
                log.info("Content for {} was truncated at {} items", sourceRef, page.getItems().size());
            }
            return page.getItems();
        } catch (ContentAccessException | ExternalServiceException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to fetch content for {}: {}", sourceRef, e.getMessage());
            throw new ExternalServiceException(SERVICE_NAME, e);
        }
    }

    /**
     * Fallback method when circuit breaker is open
     */
    @SuppressWarnings("unused")
    private List<ContentItem> fetchFallback(String sourceRef, Instant start, Instant end, SummaryOptions options, CallNotPermittedException e) {
        log.warn("Circuit breaker open for {}, source: {}", SERVICE_NAME, sourceRef);
        throw new ExternalServiceException(SERVICE_NAME, "Service temporarily unavailable (circuit breaker open)", e);
    }
}
