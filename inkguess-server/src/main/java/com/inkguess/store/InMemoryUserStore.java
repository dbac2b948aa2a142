package com.inkguess.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps accounts and login tokens in memory for the lifetime of the process.
 *
 * Tokens stay valid until their time-to-live expires, so a client can reconnect
 * with the token it already holds.
 */
public class InMemoryUserStore implements UserStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryUserStore.class);

    private final Map<String, IssuedToken> tokens = new ConcurrentHashMap<>();
    private final Map<String, UserRecord> users = new ConcurrentHashMap<>();
    private final Duration tokenTtl;
    private final Clock clock;

    public InMemoryUserStore(Duration tokenTtl) {
        this(tokenTtl, Clock.systemUTC());
    }

    public InMemoryUserStore(Duration tokenTtl, Clock clock) {
        this.tokenTtl = tokenTtl;
        this.clock = clock;
    }

    /**
     * Creates the account if needed and issues a new token for it.
     *
     * @throws IllegalArgumentException if the login is blank
     */
    public String issueToken(String login) {
        if (login == null || login.isBlank()) {
            throw new IllegalArgumentException("Login is required");
        }
        String name = login.trim();
        users.computeIfAbsent(name, n -> new UserRecord(n, 0, null));

        String token = UUID.randomUUID().toString();
        tokens.put(token, new IssuedToken(name, clock.instant().plus(tokenTtl)));
        logger.info("Issued token for {}", name);
        return token;
    }

    @Override
    public CompletableFuture<Optional<UserRecord>> findByToken(String token) {
        if (token == null) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        IssuedToken issued = tokens.get(token);
        if (issued == null) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        if (clock.instant().isAfter(issued.expiresAt)) {
            tokens.remove(token);
            logger.debug("Token for {} expired", issued.identity);
            return CompletableFuture.completedFuture(Optional.empty());
        }
        return CompletableFuture.completedFuture(Optional.ofNullable(users.get(issued.identity)));
    }

    @Override
    public CompletableFuture<Void> persistScore(String identity, int score, String gameId) {
        users.compute(identity, (name, existing) -> existing == null
                ? new UserRecord(name, score, gameId)
                : existing.withScore(score, gameId));
        return CompletableFuture.completedFuture(null);
    }

    public Optional<UserRecord> findByIdentity(String identity) {
        return Optional.ofNullable(users.get(identity));
    }

    private static final class IssuedToken {
        private final String identity;
        private final Instant expiresAt;

        private IssuedToken(String identity, Instant expiresAt) {
            this.identity = identity;
            this.expiresAt = expiresAt;
        }
    }
}
