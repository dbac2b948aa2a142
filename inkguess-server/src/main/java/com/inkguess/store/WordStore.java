package com.inkguess.store;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Source of words to draw.
 */
public interface WordStore {

    /**
     * Picks up to {@code count} distinct words at random.
     *
     * @param excludeDeleted skip words flagged as deleted
     * @return the words, or a future completed exceptionally with {@link StoreException}
     */
    CompletableFuture<List<String>> fetchRandomWords(boolean excludeDeleted, int count);
}
