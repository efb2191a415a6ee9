package com.example.summaryscheduler.client;

import com.example.summaryscheduler.config.SummaryServiceProperties;
import com.example.summaryscheduler.domain.entity.ContentItem;
import com.example.summaryscheduler.domain.entity.ScheduledTask;
import com.example.summaryscheduler.exception.ExternalServiceException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SummaryServiceClient Tests")
class SummaryServiceClientTest {

    private final List<ClientRequest> requests = new ArrayList<>();

    private final ScheduledTask task = ScheduledTask.builder()
            .id("daily-digest")
            .name("Daily digest")
            .sourceRef("C123")
            .build();

    private final List<ContentItem> items = List.of(
            ContentItem.builder().id("m1").author("ana").content("deploy done").timestamp(Instant.parse("2024-03-04T10:00:00Z")).build(),
            ContentItem.builder().id("m2").author("li").content("thanks").timestamp(Instant.parse("2024-03-04T10:05:00Z")).build());

    private SummaryServiceClient clientReturning(HttpStatus status, String body) {
        var webClient = WebClient.builder()
                .baseUrl("http://summary.test")
                .exchangeFunction(request -> {
                    requests.add(request);
                    return Mono.just(ClientResponse.create(status)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                            .body(body)
                            .build());
                })
                .build();
        var properties = new SummaryServiceProperties();
        properties.setBaseUrl("http://summary.test");
        return new SummaryServiceClient(webClient, properties);
    }

    @Test
    @DisplayName("Should build an artifact from the service response")
    void shouldProduceArtifact() {
        var body = """
                {"id":"sum-1","title":"Daily digest","summaryText":"Deploy shipped.",
                 "keyPoints":["deploy done"],"participants":["ana","li"]}
                """;

        var result = clientReturning(HttpStatus.OK, body).produce(task, items);

        assertThat(result.isProduced()).isTrue();
        var artifact = result.getArtifact();
        assertThat(artifact.getId()).isEqualTo("sum-1");
        assertThat(artifact.getTaskId()).isEqualTo("daily-digest");
        assertThat(artifact.getSourceRef()).isEqualTo("C123");
        assertThat(artifact.getItemCount()).isEqualTo(2);
        assertThat(artifact.getKeyPoints()).containsExactly("deploy done");
        assertThat(artifact.getActionItems()).isEmpty();
        assertThat(requests).singleElement().satisfies(request -> {
            assertThat(request.method()).isEqualTo(HttpMethod.POST);
            assertThat(request.url().toString()).isEqualTo("http://summary.test/api/v1/summaries");
        });
    }

    @Test
    @DisplayName("Should report insufficient content when the service answers 422")
    void shouldReportInsufficientContent() {
        var result = clientReturning(HttpStatus.UNPROCESSABLE_ENTITY, "only 2 messages").produce(task, items);

        assertThat(result.isProduced()).isFalse();
        assertThat(result.getInsufficientReason()).isEqualTo("only 2 messages");
    }

    @Test
    @DisplayName("Should wrap other error statuses as external service failures")
    void shouldWrapErrors() {
        var client = clientReturning(HttpStatus.SERVICE_UNAVAILABLE, "down");

        assertThatThrownBy(() -> client.produce(task, items))
                .isInstanceOf(ExternalServiceException.class)
                .satisfies(e -> assertThat(((ExternalServiceException) e).isRetryable()).isTrue());
    }
}
