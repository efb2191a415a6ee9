package com.example.summaryscheduler.service.alert;

import com.example.summaryscheduler.config.SlackProperties;
import com.example.summaryscheduler.domain.entity.ScheduledTask;
import com.example.summaryscheduler.domain.entity.TaskExecutionResult;
import com.slack.api.Slack;
import com.slack.api.model.Attachment;
import com.slack.api.model.Field;
import com.slack.api.webhook.Payload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Sends operator alerts to Slack when a summary task fails or gets disabled.
 */
@Slf4j
@Service
public class SlackAlertService {

    private static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z").withZone(ZoneOffset.UTC);

    private final SlackProperties slackProperties;
    private final Slack slack = Slack.getInstance();

    @Value("${spring.application.name:summary-scheduler}")
    private String applicationName;

    public SlackAlertService(SlackProperties slackProperties) {
        this.slackProperties = slackProperties;
    }

    /**
     * Alert that a task exhausted its failure budget and will not fire again
     * until resumed. Runs asynchronously to not block task processing.
     */
    @Async
    public void sendTaskDisabledAlert(ScheduledTask task) {
        if (!isConfigured()) {
            log.warn("Slack alerting is disabled or webhook URL not configured. Task {} was disabled but no alert was sent.", task.getId());
            return;
        }

        var lastError = task.getLastError() != null ? task.getLastError() : "Unknown error";
        var fields = new ArrayList<Field>(taskFields(task));
        fields.add(field("Failures", task.getFailureCount() + " / " + task.getMaxFailures(), true));
        fields.add(field("Last Run", task.getLastRun() != null ? DATE_FORMATTER.format(task.getLastRun()) : "never", true));
        fields.add(field("Last Error", "```" + truncate(lastError, 400) + "```", false));

        send(Payload.builder()
                .channel(slackProperties.getChannel())
                .username(applicationName)
                .iconEmoji(":rotating_light:")
                .text(":rotating_light: *Summary Task Disabled - Manual Resume Required*")
                .attachments(List.of(Attachment.builder()
                        .color("danger")
                        .title(task.getName())
                        .titleLink(buildTaskLink(task.getId()))
                        .fields(fields)
                        .footer(applicationName + " | Fix the cause, then resume the task")
                        .ts(String.valueOf(Instant.now().getEpochSecond()))
                        .build()))
                .build(), task.getId());
    }

    /**
     * Alert for a single failed execution that will be retried
     */
    @Async
    public void sendTaskFailureAlert(ScheduledTask task, TaskExecutionResult result) {
        if (!isConfigured()) {
            return;
        }

        var fields = new ArrayList<Field>(taskFields(task));
        fields.add(field("Error Kind", result.getErrorKind() != null ? result.getErrorKind().getCode() : "unknown", true));
        fields.add(field("Next Attempt", task.getNextRun() != null ? DATE_FORMATTER.format(task.getNextRun()) : "none", true));
        fields.add(field("Error", truncate(result.getErrorMessage(), 300), false));

        send(Payload.builder()
                .channel(slackProperties.getChannel())
                .username(applicationName)
                .iconEmoji(":warning:")
                .text(":warning: *Summary Task Failed*")
                .attachments(List.of(Attachment.builder()
                        .color("warning")
                        .title(task.getName())
                        .titleLink(buildTaskLink(task.getId()))
                        .fields(fields)
                        .footer(applicationName)
                        .ts(String.valueOf(Instant.now().getEpochSecond()))
                        .build()))
                .build(), task.getId());
    }

    /**
     * Send generic error alert
     */
    @Async
    public void sendErrorAlert(String title, String message, String details) {
        if (!isConfigured()) {
            log.warn("Slack alerting disabled. Error alert not sent: {}", title);
            return;
        }

        send(Payload.builder()
                .channel(slackProperties.getChannel())
                .username(applicationName)
                .iconEmoji(":warning:")
                .text(":warning: *" + title + "*")
                .attachments(List.of(Attachment.builder()
                        .color("warning")
                        .text(message)
                        .fields(details != null ? List.of(field("Details", truncate(details, 500), false)) : List.of())
                        .footer(applicationName)
                        .ts(String.valueOf(Instant.now().getEpochSecond()))
                        .build()))
                .build(), null);
    }

    private void send(Payload payload, String taskId) {
        try {
            var response = slack.send(slackProperties.getWebhookUrl(), payload);
            if (response.getCode() != 200) {
                log.error("Failed to send Slack alert. Response code: {}, body: {}", response.getCode(), response.getBody());
            } else {
                log.info("Slack alert sent{}", taskId != null ? " for task " + taskId : "");
            }
        } catch (Exception e) {
            log.error("Error sending Slack alert{}: {}", taskId != null ? " for task " + taskId : "", e.getMessage(), e);
        }
    }

    private List<Field> taskFields(ScheduledTask task) {
        return List.of(
                field("Task ID", task.getId(), true),
                field("Source", task.getSourceRef(), true),
                field("Created By", task.getCreatedBy() != null ? task.getCreatedBy() : "unknown", true)
        );
    }

    private Field field(String title, String value, boolean shortEnough) {
        return Field.builder().title(title).value(value).valueShortEnough(shortEnough).build();
    }

    private boolean isConfigured() {
        return slackProperties.isEnabled() && slackProperties.getWebhookUrl() != null && !slackProperties.getWebhookUrl().isBlank();
    }

    private String buildTaskLink(String taskId) {
        return slackProperties.getDashboardBaseUrl() + "/api/v1/tasks/" + taskId;
    }

    private String truncate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength - 3) + "...";
    }
}
