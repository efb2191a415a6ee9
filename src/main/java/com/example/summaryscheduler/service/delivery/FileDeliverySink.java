package com.example.summaryscheduler.service.delivery;

import com.example.summaryscheduler.domain.entity.DeliveryOutcome;
import com.example.summaryscheduler.domain.entity.Destination;
import com.example.summaryscheduler.domain.entity.SummaryArtifact;
import com.example.summaryscheduler.domain.enums.DestinationType;
import com.example.summaryscheduler.service.collaborator.DeliverySink;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Writes each summary as a new file in the destination directory.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FileDeliverySink implements DeliverySink {

    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneOffset.UTC);

    private final ArtifactFormatter formatter;

    @Override
    public DestinationType getDestinationType() {
        return DestinationType.FILE;
    }

    @Override
    public DeliveryOutcome deliver(SummaryArtifact artifact, Destination destination) {
        try {
            var directory = Paths.get(destination.getTarget());
            Files.createDirectories(directory);

            var createdAt = artifact.getCreatedAt() != null ? artifact.getCreatedAt() : Instant.now();
            var fileName = String.format("%s-%s-%s.%s",
                    artifact.getTaskId(), FILE_TIMESTAMP.format(createdAt), artifact.getId(),
                    formatter.extensionFor(destination.getFormat()));
            var file = directory.resolve(fileName);

            Files.writeString(file, formatter.render(artifact, destination.getFormat()), StandardCharsets.UTF_8);
            log.info("Wrote summary {} to {}", artifact.getId(), file);
            return DeliveryOutcome.delivered(destination, "Written to " + file);
        } catch (Exception e) {
            log.error("Error writing summary {} to {}: {}", artifact.getId(), destination.getTarget(), e.getMessage());
            return DeliveryOutcome.failed(destination, e.getMessage());
        }
    }
}
