package com.inkguess;

import com.inkguess.server.InkGuessServer;
import com.inkguess.server.ServerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the InkGuess game server.
 *
 * Players log in over HTTP, then take turns drawing a secret word on a shared
 * canvas over a WebSocket while the others race to guess it in the chat.
 */
public class Main {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        ServerConfig config = ServerConfig.load(args, System.getenv());

        logger.info("===========================================");
        logger.info("  InkGuess Game Server");
        logger.info("  Starting on port {}", config.getPort());
        logger.info("  Word store: {}, rounds per game: {}", config.getStoreUrl(), config.getMaxRounds());
        logger.info("===========================================");

        InkGuessServer server;
        try {
            server = new InkGuessServer(config);
        } catch (RuntimeException e) {
            logger.error("Failed to initialize server", e);
            System.exit(1);
            return;
        }

        // Graceful shutdown hook
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutdown signal received, stopping server...");
            server.shutdown();
        }));

        try {
            server.start();
        } catch (Exception e) {
            logger.error("Failed to start server", e);
            System.exit(1);
        }
    }
}
