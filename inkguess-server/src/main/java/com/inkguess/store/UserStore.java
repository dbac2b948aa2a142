package com.inkguess.store;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Account lookup and score persistence.
 */
public interface UserStore {

    /**
     * Resolves a login token.
     *
     * @return the user, or empty when the token is unknown or expired
     */
    CompletableFuture<Optional<UserRecord>> findByToken(String token);

    /**
     * Saves a cumulative score together with the game it belongs to.
     * Callers do not wait for the result.
     */
    CompletableFuture<Void> persistScore(String identity, int score, String gameId);
}
