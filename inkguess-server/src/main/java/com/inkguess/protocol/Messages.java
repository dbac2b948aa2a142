package com.inkguess.protocol;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Map;

/**
 * Factory methods for every server → client message.
 *
 * Keeps payload field names in one place so the game logic never
 * assembles JSON by hand.
 */
public final class Messages {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private Messages() {
    }

    public static Message handshake(String name) {
        ObjectNode payload = NODES.objectNode();
        payload.put("name", name);
        return build(MessageType.HANDSHAKE, payload);
    }

    public static Message draw(DrawOp op) {
        return build(MessageType.DRAW, op.toPayload());
    }

    public static Message chat(String sender, String text, String color) {
        ObjectNode payload = NODES.objectNode();
        payload.put("sender", sender);
        payload.put("text", text);
        payload.put("color", color);
        return build(MessageType.CHAT, payload);
    }

    public static Message wordChoices(List<String> words) {
        ObjectNode payload = NODES.objectNode();
        ArrayNode array = payload.putArray("words");
        words.forEach(array::add);
        return build(MessageType.WORD_CHOICES, payload);
    }

    public static Message startRound(String drawer, String wordOrHint, int roundNumber) {
        ObjectNode payload = NODES.objectNode();
        payload.put("drawer", drawer);
        payload.put("wordOrHint", wordOrHint);
        payload.put("roundNumber", roundNumber);
        return build(MessageType.START_ROUND, payload);
    }

    public static Message endRound(String word, Map<String, Integer> scores) {
        ObjectNode payload = NODES.objectNode();
        payload.put("word", word);
        ObjectNode scoresNode = payload.putObject("scores");
        scores.forEach(scoresNode::put);
        return build(MessageType.END_ROUND, payload);
    }

    public static Message player(String name, int score, boolean guessed) {
        ObjectNode payload = NODES.objectNode();
        payload.put("name", name);
        ObjectNode state = payload.putObject("state");
        state.put("score", score);
        state.put("guessed", guessed);
        return build(MessageType.PLAYER, payload);
    }

    public static Message playerDisconnected(String name) {
        ObjectNode payload = NODES.objectNode();
        payload.put("name", name);
        return build(MessageType.PLAYER_DISCONNECTED, payload);
    }

    public static Message timer(int remainingTime) {
        ObjectNode payload = NODES.objectNode();
        payload.put("remainingTime", remainingTime);
        return build(MessageType.TIMER, payload);
    }

    public static Message word(String word) {
        ObjectNode payload = NODES.objectNode();
        payload.put("word", word);
        return build(MessageType.WORD, payload);
    }

    public static Message gameOver() {
        return build(MessageType.GAME_OVER, NODES.objectNode());
    }

    public static Message error(String message) {
        ObjectNode payload = NODES.objectNode();
        payload.put("message", message);
        return build(MessageType.ERROR, payload);
    }

    private static Message build(MessageType type, ObjectNode payload) {
        return Message.builder()
                .type(type)
                .payload(payload)
                .build();
    }
}
