package com.inkguess.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.*;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Draw Operation Tests")
class DrawOpTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    @DisplayName("Stroke payload should keep tool and coordinates")
    void testStroke() throws Exception {
        JsonNode payload = mapper.readTree("{\"tool\":\"pen\",\"x\":10.5,\"y\":3.0,\"prevX\":9.0,\"prevY\":2.0}");

        DrawOp op = DrawOp.fromPayload(payload);

        assertEquals(DrawOp.Kind.STROKE, op.kind());
        DrawOp.Stroke stroke = (DrawOp.Stroke) op;
        assertEquals("pen", stroke.getTool());
        assertEquals(10.5, stroke.getX());
        assertEquals(2.0, stroke.getPrevY());
        assertEquals(payload, op.toPayload());
    }

    @Test
    @DisplayName("Clear tool should become a clear operation")
    void testClear() throws Exception {
        DrawOp op = DrawOp.fromPayload(mapper.readTree("{\"tool\":\"clear\"}"));

        assertEquals(DrawOp.Kind.CLEAR, op.kind());
        assertSame(DrawOp.clear(), op);
        assertEquals("clear", op.toPayload().get("tool").asText());
    }

    @Test
    @DisplayName("Payload without a tool should be rejected")
    void testMissingTool() throws Exception {
        assertThrows(IllegalArgumentException.class, () -> DrawOp.fromPayload(mapper.readTree("{\"x\":1}")));
        assertThrows(IllegalArgumentException.class, () -> DrawOp.fromPayload(null));
    }
}
