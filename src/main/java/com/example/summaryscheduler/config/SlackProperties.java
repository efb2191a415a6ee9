package com.example.summaryscheduler.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Slack configuration properties.
 * <p>
 * The webhook is used for operator alerts, the bot token for channel deliveries.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "slack")
public class SlackProperties {
    private String webhookUrl;
    private String channel = "#summary-alerts";
    private boolean enabled = true;
    private String botToken;
    private String dashboardBaseUrl = "http://localhost:8080";
}
