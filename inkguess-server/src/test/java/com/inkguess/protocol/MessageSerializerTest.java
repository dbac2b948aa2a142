package com.inkguess.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.*;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Message Serializer Tests")
class MessageSerializerTest {

    private final MessageSerializer serializer = new MessageSerializer();

    @Test
    @DisplayName("Types should use their hyphenated wire names")
    void testWireNames() throws Exception {
        String json = serializer.serialize(Messages.wordChoices(List.of("apple", "pear")));
        JsonNode node = serializer.getObjectMapper().readTree(json);

        assertEquals("word-choices", node.get("type").asText());
        assertEquals("pear", node.get("payload").get("words").get(1).asText());
        assertTrue(node.get("timestamp").asLong() > 0);
    }

    @Test
    @DisplayName("Player update should nest score and guessed under state")
    void testPlayerPayload() throws Exception {
        JsonNode node = serializer.getObjectMapper().readTree(
                serializer.serialize(Messages.player("alice", 12, true)));

        assertEquals("player", node.get("type").asText());
        assertEquals("alice", node.get("payload").get("name").asText());
        assertEquals(12, node.get("payload").get("state").get("score").asInt());
        assertTrue(node.get("payload").get("state").get("guessed").asBoolean());
    }

    @Test
    @DisplayName("End of round should carry the ledger under scores")
    void testEndRoundPayload() throws Exception {
        JsonNode node = serializer.getObjectMapper().readTree(
                serializer.serialize(Messages.endRound("apple", Map.of("bob", 45))));

        assertEquals("end-round", node.get("type").asText());
        assertEquals(45, node.get("payload").get("scores").get("bob").asInt());
    }

    @Test
    @DisplayName("Client messages should parse, ignoring unknown fields")
    void testDeserialize() {
        Message message = serializer.deserialize(
                "{\"type\":\"chat\",\"payload\":{\"sender\":\"bob\",\"text\":\"hi\"},\"extra\":1}");

        assertEquals(MessageType.CHAT, message.getType());
        assertEquals("hi", message.getPayload().get("text").asText());
    }

    @Test
    @DisplayName("Malformed or untyped messages should be rejected")
    void testRejects() {
        assertThrows(IllegalArgumentException.class, () -> serializer.deserialize("not json"));
        assertThrows(IllegalArgumentException.class, () -> serializer.deserialize("{\"type\":\"teleport\"}"));
        assertThrows(IllegalArgumentException.class, () -> serializer.deserialize("{\"payload\":{}}"));
    }
}
