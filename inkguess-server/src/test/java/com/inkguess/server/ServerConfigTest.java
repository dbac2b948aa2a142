package com.inkguess.server;

import com.inkguess.store.InMemoryWordStore;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Server Config Tests")
class ServerConfigTest {

    @Test
    @DisplayName("Empty environment should give the defaults")
    void testDefaults() {
        ServerConfig config = ServerConfig.load(new String[0], Map.of());

        assertEquals(8080, config.getPort());
        assertEquals("memory:", config.getStoreUrl());
        assertEquals(3, config.getMaxRounds());
        assertEquals(1000, config.getTickMillis());
        assertEquals(Duration.ofMinutes(720), config.getTokenTtl());
        assertEquals(600, config.getIdleTimeoutSeconds());
    }

    @Test
    @DisplayName("Environment variables should override defaults and the argument the port")
    void testOverrides() {
        Map<String, String> env = Map.of(
                "PORT", "9000",
                "STORE_URL", "file:/tmp/words.txt",
                "MAX_ROUNDS", "5",
                "TICK_MILLIS", "250",
                "TOKEN_TTL_MINUTES", "15");

        ServerConfig config = ServerConfig.load(new String[]{"9100"}, env);

        assertEquals(9100, config.getPort());
        assertEquals("file:/tmp/words.txt", config.getStoreUrl());
        assertEquals(5, config.getMaxRounds());
        assertEquals(250, config.getTickMillis());
        assertEquals(Duration.ofMinutes(15), config.getTokenTtl());
    }

    @Test
    @DisplayName("Invalid values should fall back to the defaults")
    void testInvalidValues() {
        ServerConfig config = ServerConfig.load(new String[]{"http"}, Map.of("MAX_ROUNDS", "-1", "PORT", "x"));

        assertEquals(8080, config.getPort());
        assertEquals(3, config.getMaxRounds());
        assertEquals(9191, config.withPort(9191).getPort());
    }

    @Test
    @DisplayName("Store URL should pick the word list source")
    void testStoreUrl() {
        assertInstanceOf(InMemoryWordStore.class, InkGuessServer.openWordStore("memory:"));
        assertThrows(IllegalArgumentException.class, () -> InkGuessServer.openWordStore("jdbc:h2:mem:words"));
    }
}
