package com.example.summaryscheduler.service.delivery;

import com.example.summaryscheduler.domain.entity.SummaryArtifact;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Renders an artifact as text for a destination format.
 */
@Component
@RequiredArgsConstructor
public class ArtifactFormatter {

    private static final DateTimeFormatter WINDOW_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm 'UTC'").withZone(ZoneOffset.UTC);

    private final ObjectMapper objectMapper;

    public String render(SummaryArtifact artifact, String format) {
        var normalized = format == null ? "markdown" : format.toLowerCase();
        return switch (normalized) {
            case "json" -> toJson(artifact);
            case "plain", "text" -> toPlain(artifact);
            default -> toMarkdown(artifact);
        };
    }

    /**
     * File extension matching {@link #render(SummaryArtifact, String)}
     */
    public String extensionFor(String format) {
        var normalized = format == null ? "markdown" : format.toLowerCase();
        return switch (normalized) {
            case "json" -> "json";
            case "plain", "text" -> "txt";
            default -> "md";
        };
    }

    private String toMarkdown(SummaryArtifact artifact) {
        var sb = new StringBuilder();
        sb.append("## ").append(title(artifact)).append("\n\n");
        appendWindow(sb, artifact, "_");
        sb.append(artifact.getSummaryText() != null ? artifact.getSummaryText() : "").append("\n");
        appendSection(sb, "### Key Points", artifact.getKeyPoints(), "- ");
        appendSection(sb, "### Action Items", artifact.getActionItems(), "- [ ] ");
        if (!artifact.getParticipants().isEmpty()) {
            sb.append("\n**Participants:** ").append(String.join(", ", artifact.getParticipants())).append("\n");
        }
        return sb.toString();
    }

    private String toPlain(SummaryArtifact artifact) {
        var sb = new StringBuilder();
        sb.append(title(artifact)).append("\n\n");
        appendWindow(sb, artifact, "");
        sb.append(artifact.getSummaryText() != null ? artifact.getSummaryText() : "").append("\n");
        appendSection(sb, "Key points:", artifact.getKeyPoints(), "* ");
        appendSection(sb, "Action items:", artifact.getActionItems(), "* ");
        return sb.toString();
    }

    private String toJson(SummaryArtifact artifact) {
        try {
            return objectMapper.writeValueAsString(artifact);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize artifact " + artifact.getId(), e);
        }
    }

    private void appendWindow(StringBuilder sb, SummaryArtifact artifact, String emphasis) {
        if (artifact.getWindowStart() != null && artifact.getWindowEnd() != null) {
            sb.append(emphasis)
                    .append(WINDOW_FORMAT.format(artifact.getWindowStart()))
                    .append(" to ")
                    .append(WINDOW_FORMAT.format(artifact.getWindowEnd()))
                    .append(", ").append(artifact.getItemCount()).append(" messages")
                    .append(emphasis).append("\n\n");
        }
    }

    private void appendSection(StringBuilder sb, String heading, List<String> lines, String bullet) {
        if (lines == null || lines.isEmpty()) {
            return;
        }
        sb.append("\n").append(heading).append("\n");
        lines.forEach(line -> sb.append(bullet).append(line).append("\n"));
    }

    private String title(SummaryArtifact artifact) {
        return artifact.getTitle() != null ? artifact.getTitle() : "Summary";
    }
}
