package com.example.summaryscheduler.service.delivery;

import com.example.summaryscheduler.domain.enums.DestinationType;
import com.example.summaryscheduler.service.collaborator.DeliverySink;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Registry for delivery sinks.
 * <p>
 * Discovers every {@link DeliverySink} bean and provides lookup by destination type.
 */
@Slf4j
@Component
public class DeliverySinkRegistry {

    private final Map<DestinationType, DeliverySink> sinks = new EnumMap<>(DestinationType.class);

    public DeliverySinkRegistry(List<DeliverySink> sinkBeans) {
        for (var sink : sinkBeans) {
            var type = sink.getDestinationType();
            if (sinks.containsKey(type)) {
                log.warn("Duplicate sink for destination type {}: {} will override {}",
                        type, sink.getClass().getSimpleName(), sinks.get(type).getClass().getSimpleName());
            }
            sinks.put(type, sink);
            log.info("Registered delivery sink for {}: {}", type, sink.getClass().getSimpleName());
        }

        for (var type : DestinationType.values()) {
            if (!sinks.containsKey(type)) {
                log.warn("No delivery sink registered for destination type: {}", type);
            }
        }
    }

    public Optional<DeliverySink> getSink(DestinationType type) {
        return Optional.ofNullable(sinks.get(type));
    }

    public boolean hasSink(DestinationType type) {
        return sinks.containsKey(type);
    }

    public Set<DestinationType> getRegisteredTypes() {
        return sinks.keySet();
    }
}
