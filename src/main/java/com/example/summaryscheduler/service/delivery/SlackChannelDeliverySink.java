package com.example.summaryscheduler.service.delivery;

import com.example.summaryscheduler.config.SlackProperties;
import com.example.summaryscheduler.domain.entity.DeliveryOutcome;
import com.example.summaryscheduler.domain.entity.Destination;
import com.example.summaryscheduler.domain.entity.SummaryArtifact;
import com.example.summaryscheduler.domain.enums.DestinationType;
import com.example.summaryscheduler.service.collaborator.DeliverySink;
import com.slack.api.Slack;
import com.slack.api.methods.request.chat.ChatPostMessageRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Posts summaries to a chat channel through the Slack Web API.
 */
@Slf4j
@Component
public class SlackChannelDeliverySink implements DeliverySink {

    static final int MAX_MESSAGE_LENGTH = 3900;

    private final SlackProperties slackProperties;
    private final ArtifactFormatter formatter;
    private final Slack slack;

    @Autowired
    public SlackChannelDeliverySink(SlackProperties slackProperties, ArtifactFormatter formatter) {
        this(slackProperties, formatter, Slack.getInstance());
    }

    SlackChannelDeliverySink(SlackProperties slackProperties, ArtifactFormatter formatter, Slack slack) {
        this.slackProperties = slackProperties;
        this.formatter = formatter;
        this.slack = slack;
    }

    @Override
    public DestinationType getDestinationType() {
        return DestinationType.CHANNEL;
    }

    @Override
    public DeliveryOutcome deliver(SummaryArtifact artifact, Destination destination) {
        var token = slackProperties.getBotToken();
        if (token == null || token.isBlank()) {
            return DeliveryOutcome.failed(destination, "Slack bot token not configured");
        }

        var text = truncate(formatter.render(artifact, "markdown"));
        var request = ChatPostMessageRequest.builder()
                .channel(destination.getTarget())
                .text(text)
                .mrkdwn(true)
                .build();

        try {
            var response = slack.methods(token).chatPostMessage(request);
            if (!response.isOk()) {
                log.warn("Slack rejected summary {} for channel {}: {}", artifact.getId(), destination.getTarget(), response.getError());
                return DeliveryOutcome.failed(destination, "Slack error: " + response.getError());
            }
            log.info("Delivered summary {} to channel {}", artifact.getId(), destination.getTarget());
            return DeliveryOutcome.delivered(destination, "Posted message " + response.getTs());
        } catch (Exception e) {
            log.error("Error posting summary {} to channel {}: {}", artifact.getId(), destination.getTarget(), e.getMessage(), e);
            return DeliveryOutcome.failed(destination, e.getMessage());
        }
    }

    private String truncate(String text) {
        if (text.length() <= MAX_MESSAGE_LENGTH) {
            return text;
        }
        return text.substring(0, MAX_MESSAGE_LENGTH - 3) + "...";
    }
}
