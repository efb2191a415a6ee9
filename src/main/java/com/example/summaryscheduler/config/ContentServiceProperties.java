package com.example.summaryscheduler.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Content service connection properties
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "external-services.content-service")
public class ContentServiceProperties {
    @NotBlank
    private String baseUrl;
    private int timeoutSeconds = 30;
    private int maxItems = 1000;
}
