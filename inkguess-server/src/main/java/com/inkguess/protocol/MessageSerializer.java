package com.inkguess.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handles serialization/deserialization of protocol messages as JSON.
 *
 * The serializer is thread-safe - ObjectMapper is thread-safe after configuration,
 * so Netty I/O threads and the game loop share one instance.
 */
public class MessageSerializer {

    private static final Logger logger = LoggerFactory.getLogger(MessageSerializer.class);

    private final ObjectMapper objectMapper;

    public MessageSerializer() {
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Serializes a Message to JSON string.
     *
     * @param message The message to serialize
     * @return JSON string representation
     */
    public String serialize(Message message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            logger.error("Failed to serialize message: {}", message, e);
            throw new IllegalStateException("Serialization failed", e);
        }
    }

    /**
     * Deserializes a JSON string to Message.
     *
     * @param json The JSON string to deserialize
     * @return Deserialized Message object
     * @throws IllegalArgumentException if the text is not a valid message
     */
    public Message deserialize(String json) {
        try {
            Message message = objectMapper.readValue(json, Message.class);
            if (message == null || message.getType() == null) {
                throw new IllegalArgumentException("Message type is required");
            }
            return message;
        } catch (JsonProcessingException e) {
            logger.debug("Failed to deserialize message: {}", json, e);
            throw new IllegalArgumentException("Invalid message: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Gets the underlying ObjectMapper for advanced operations.
     */
    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }
}
