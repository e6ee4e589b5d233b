package com.z254.commander.broadcast;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.z254.commander.domain.model.DashboardMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Encodes dashboard messages into the snake_case JSON envelope the dashboards read:
 * {@code {"message_id", "type", "timestamp", "priority", "data"}}.
 */
@Slf4j
@Component
public class DashboardMessageCodec {

    private final ObjectMapper objectMapper;

    public DashboardMessageCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * @return the JSON text, or empty when the payload cannot be serialized
     */
    public Optional<String> encode(DashboardMessage message) {
        try {
            return Optional.of(objectMapper.writeValueAsString(message));
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize {} message {}: {}",
                    message.getType(), message.getMessageId(), e.getMessage());
            return Optional.empty();
        }
    }
}
