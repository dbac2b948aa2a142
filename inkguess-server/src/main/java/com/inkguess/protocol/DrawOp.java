package com.inkguess.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * A single drawing operation: either a stroke segment or a canvas clear.
 *
 * On the wire both share the {@code draw} message type and are told apart by the
 * {@code tool} field, {@code "clear"} meaning {@link Clear}.
 */
public abstract class DrawOp {

    public static final String CLEAR_TOOL = "clear";

    public enum Kind {
        STROKE,
        CLEAR
    }

    private DrawOp() {
    }

    public abstract Kind kind();

    public abstract ObjectNode toPayload();

    /**
     * Parses a draw payload.
     *
     * @throws IllegalArgumentException if the payload is missing or has no tool
     */
    public static DrawOp fromPayload(JsonNode payload) {
        if (payload == null || !payload.hasNonNull("tool")) {
            throw new IllegalArgumentException("Draw payload requires a tool");
        }
        String tool = payload.get("tool").asText();
        if (CLEAR_TOOL.equals(tool)) {
            return Clear.INSTANCE;
        }
        return new Stroke(tool,
                payload.path("x").asDouble(),
                payload.path("y").asDouble(),
                payload.path("prevX").asDouble(),
                payload.path("prevY").asDouble());
    }

    public static DrawOp clear() {
        return Clear.INSTANCE;
    }

    public static DrawOp stroke(String tool, double x, double y, double prevX, double prevY) {
        return new Stroke(tool, x, y, prevX, prevY);
    }

    /**
     * One line segment from (prevX, prevY) to (x, y) drawn with a tool.
     */
    public static final class Stroke extends DrawOp {
        private final String tool;
        private final double x;
        private final double y;
        private final double prevX;
        private final double prevY;

        private Stroke(String tool, double x, double y, double prevX, double prevY) {
            this.tool = tool;
            this.x = x;
            this.y = y;
            this.prevX = prevX;
            this.prevY = prevY;
        }

        @Override
        public Kind kind() {
            return Kind.STROKE;
        }

        @Override
        public ObjectNode toPayload() {
            ObjectNode node = JsonNodeFactory.instance.objectNode();
            node.put("tool", tool);
            node.put("x", x);
            node.put("y", y);
            node.put("prevX", prevX);
            node.put("prevY", prevY);
            return node;
        }

        public String getTool() {
            return tool;
        }

        public double getX() {
            return x;
        }

        public double getY() {
            return y;
        }

        public double getPrevX() {
            return prevX;
        }

        public double getPrevY() {
            return prevY;
        }

        @Override
        public String toString() {
            return "Stroke{" +
                    "tool='" + tool + '\'' +
                    ", x=" + x +
                    ", y=" + y +
                    '}';
        }
    }

    /**
     * Wipes the whole canvas.
     */
    public static final class Clear extends DrawOp {
        private static final Clear INSTANCE = new Clear();

        private Clear() {
        }

        @Override
        public Kind kind() {
            return Kind.CLEAR;
        }

        @Override
        public ObjectNode toPayload() {
            ObjectNode node = JsonNodeFactory.instance.objectNode();
            node.put("tool", CLEAR_TOOL);
            return node;
        }

        @Override
        public String toString() {
            return "Clear";
        }
    }
}
