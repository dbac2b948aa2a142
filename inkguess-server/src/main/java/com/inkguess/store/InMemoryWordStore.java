package com.inkguess.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Word list held in memory, loaded from a text file with one word per line.
 * Blank lines and lines starting with {@code #} are skipped.
 */
public class InMemoryWordStore implements WordStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryWordStore.class);

    public static final String DEFAULT_RESOURCE = "/words.txt";

    private final List<String> words;
    private final Set<String> deleted = ConcurrentHashMap.newKeySet();
    private final Random random;

    public InMemoryWordStore(Collection<String> words) {
        this(words, new Random());
    }

    public InMemoryWordStore(Collection<String> words, Random random) {
        this.words = new CopyOnWriteArrayList<>(new LinkedHashSet<>(words));
        this.random = random;
    }

    public static InMemoryWordStore fromClasspath(String resource) {
        InputStream in = InMemoryWordStore.class.getResourceAsStream(resource);
        if (in == null) {
            throw new StoreException("Word list not found on classpath: " + resource);
        }
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            return fromLines(reader.lines().collect(Collectors.toList()), resource);
        } catch (IOException e) {
            throw new StoreException("Failed to read word list " + resource, e);
        }
    }

    public static InMemoryWordStore fromFile(Path file) {
        try {
            return fromLines(Files.readAllLines(file, StandardCharsets.UTF_8), file.toString());
        } catch (IOException e) {
            throw new StoreException("Failed to read word list " + file, e);
        }
    }

    private static InMemoryWordStore fromLines(List<String> lines, String source) {
        List<String> words = lines.stream()
                .map(String::trim)
                .filter(line -> !line.isEmpty() && !line.startsWith("#"))
                .collect(Collectors.toList());
        logger.info("Loaded {} words from {}", words.size(), source);
        return new InMemoryWordStore(words);
    }

    @Override
    public CompletableFuture<List<String>> fetchRandomWords(boolean excludeDeleted, int count) {
        List<String> pool = new ArrayList<>();
        for (String word : words) {
            if (!excludeDeleted || !deleted.contains(word)) {
                pool.add(word);
            }
        }
        if (pool.isEmpty()) {
            return CompletableFuture.failedFuture(new StoreException("No words available"));
        }
        synchronized (random) {
            Collections.shuffle(pool, random);
        }
        return CompletableFuture.completedFuture(List.copyOf(pool.subList(0, Math.min(count, pool.size()))));
    }

    public void addWord(String word) {
        if (!words.contains(word)) {
            words.add(word);
        }
    }

    /**
     * Flags a word so {@code fetchRandomWords(true, ..)} no longer returns it.
     */
    public void markDeleted(String word) {
        deleted.add(word);
    }

    public int size() {
        return words.size();
    }
}
