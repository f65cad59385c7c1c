package com.annograph.query.events;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
@ConditionalOnProperty(name = "annograph.events.enabled", havingValue = "true", matchIfMissing = true)
public class ExtractEventConsumer {

    private static final Logger log = LoggerFactory.getLogger(ExtractEventConsumer.class);

    private final ExtractEventHandler eventHandler;
    private final ObjectMapper mapper;

    public ExtractEventConsumer(ExtractEventHandler eventHandler, ObjectMapper mapper) {
        this.eventHandler = eventHandler;
        this.mapper = mapper;
    }

    @KafkaListener(
            topics = "${annograph.events.topic:extract-events}",
            groupId = "${spring.kafka.consumer.group-id:annograph-query}"
    )
    public void consume(String message) {
        Optional<ExtractEvent> event = parse(message);
        if (event.isEmpty()) {
            return;
        }
        eventHandler.handle(event.get());
    }

    Optional<ExtractEvent> parse(String message) {
        JsonNode node;
        try {
            node = mapper.readTree(message);
        } catch (JsonProcessingException ex) {
            log.warn("event=extract_event_malformed cause={}", ex.getOriginalMessage());
            return Optional.empty();
        }
        if (node == null || !node.isObject()) {
            log.warn("event=extract_event_malformed cause=not_an_object");
            return Optional.empty();
        }
        Optional<ExtractEventType> type = ExtractEventType.parse(node.path("type").asText(null));
        if (type.isEmpty()) {
            log.warn("event=extract_event_unknown_type type={}", node.path("type").asText(""));
            return Optional.empty();
        }
        return Optional.of(new ExtractEvent(
                type.get(),
                optionalLong(node, "extractId"),
                optionalLong(node, "documentId"),
                optionalLong(node, "datacellId")
        ));
    }

    private static Long optionalLong(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isTextual()) {
            String text = value.asText().trim();
            return text.matches("\\d+") ? Long.valueOf(text) : null;
        }
        return value.isIntegralNumber() && value.canConvertToLong() ? value.asLong() : null;
    }
}
