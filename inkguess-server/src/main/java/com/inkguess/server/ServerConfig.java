package com.inkguess.server;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;

/**
 * Server settings read from the command line and environment variables.
 *
 * - {@code PORT} or the first argument: listen port (default 8080)
 * - {@code STORE_URL}: {@code memory:} for the bundled word list, or {@code file:<path>}
 * - {@code MAX_ROUNDS}: drawer rotations per game (default 3)
 * - {@code TICK_MILLIS}: length of one timer unit (default 1000)
 * - {@code TOKEN_TTL_MINUTES}: login token lifetime (default 720)
 * - {@code IDLE_TIMEOUT_SECONDS}: close connections silent for this long (default 600)
 *
 * Invalid values are logged and replaced by the default.
 */
public class ServerConfig {

    private static final Logger logger = LoggerFactory.getLogger(ServerConfig.class);

    public static final int DEFAULT_PORT = 8080;
    public static final String DEFAULT_STORE_URL = "memory:";
    public static final int DEFAULT_MAX_ROUNDS = 3;
    public static final long DEFAULT_TICK_MILLIS = 1000;
    public static final long DEFAULT_TOKEN_TTL_MINUTES = 720;
    public static final int DEFAULT_IDLE_TIMEOUT_SECONDS = 600;

    private final int port;
    private final String storeUrl;
    private final int maxRounds;
    private final long tickMillis;
    private final Duration tokenTtl;
    private final int idleTimeoutSeconds;

    public ServerConfig(int port, String storeUrl, int maxRounds, long tickMillis,
                        Duration tokenTtl, int idleTimeoutSeconds) {
        this.port = port;
        this.storeUrl = storeUrl;
        this.maxRounds = maxRounds;
        this.tickMillis = tickMillis;
        this.tokenTtl = tokenTtl;
        this.idleTimeoutSeconds = idleTimeoutSeconds;
    }

    public static ServerConfig defaults() {
        return new ServerConfig(DEFAULT_PORT, DEFAULT_STORE_URL, DEFAULT_MAX_ROUNDS, DEFAULT_TICK_MILLIS,
                Duration.ofMinutes(DEFAULT_TOKEN_TTL_MINUTES), DEFAULT_IDLE_TIMEOUT_SECONDS);
    }

    /**
     * Reads the environment, then lets the first command line argument override the port.
     */
    public static ServerConfig load(String[] args, Map<String, String> env) {
        int port = parseInt("PORT", env.get("PORT"), DEFAULT_PORT);
        if (args.length > 0) {
            port = parseInt("port argument", args[0], port);
        }
        String storeUrl = env.getOrDefault("STORE_URL", DEFAULT_STORE_URL);
        int maxRounds = parseInt("MAX_ROUNDS", env.get("MAX_ROUNDS"), DEFAULT_MAX_ROUNDS);
        long tickMillis = parseInt("TICK_MILLIS", env.get("TICK_MILLIS"), (int) DEFAULT_TICK_MILLIS);
        long ttlMinutes = parseInt("TOKEN_TTL_MINUTES", env.get("TOKEN_TTL_MINUTES"), (int) DEFAULT_TOKEN_TTL_MINUTES);
        int idleTimeout = parseInt("IDLE_TIMEOUT_SECONDS", env.get("IDLE_TIMEOUT_SECONDS"), DEFAULT_IDLE_TIMEOUT_SECONDS);

        return new ServerConfig(port, storeUrl, maxRounds, tickMillis, Duration.ofMinutes(ttlMinutes), idleTimeout);
    }

    private static int parseInt(String name, String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        int parsed;
        try {
            parsed = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid {} '{}', using default {}", name, value, defaultValue);
            return defaultValue;
        }
        if (parsed <= 0) {
            logger.warn("{} must be positive, got {}, using default {}", name, parsed, defaultValue);
            return defaultValue;
        }
        return parsed;
    }

    public int getPort() {
        return port;
    }

    public String getStoreUrl() {
        return storeUrl;
    }

    public int getMaxRounds() {
        return maxRounds;
    }

    public long getTickMillis() {
        return tickMillis;
    }

    public Duration getTokenTtl() {
        return tokenTtl;
    }

    public int getIdleTimeoutSeconds() {
        return idleTimeoutSeconds;
    }

    public ServerConfig withPort(int newPort) {
        return new ServerConfig(newPort, storeUrl, maxRounds, tickMillis, tokenTtl, idleTimeoutSeconds);
    }

    @Override
    public String toString() {
        return "ServerConfig{" +
                "port=" + port +
                ", storeUrl='" + storeUrl + '\'' +
                ", maxRounds=" + maxRounds +
                ", tickMillis=" + tickMillis +
                '}';
    }
}
