package com.inkguess.store;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("In-Memory Word Store Tests")
class InMemoryWordStoreTest {

    @Test
    @DisplayName("Bundled word list should load without comments")
    void testClasspathWords() {
        InMemoryWordStore store = InMemoryWordStore.fromClasspath(InMemoryWordStore.DEFAULT_RESOURCE);

        assertTrue(store.size() > 20);
        List<String> words = store.fetchRandomWords(true, store.size()).join();
        assertTrue(words.stream().noneMatch(w -> w.startsWith("#") || w.isBlank()));
    }

    @Test
    @DisplayName("Sample should be distinct and no larger than requested")
    void testSample() {
        InMemoryWordStore store = new InMemoryWordStore(List.of("a", "b", "c", "d", "e"), new Random(3));

        List<String> words = store.fetchRandomWords(true, 3).join();

        assertEquals(3, words.size());
        assertEquals(3, new HashSet<>(words).size());
        assertEquals(5, store.fetchRandomWords(true, 50).join().size());
    }

    @Test
    @DisplayName("Deleted words should only be excluded on request")
    void testDeletedWords() {
        InMemoryWordStore store = new InMemoryWordStore(List.of("apple", "pear"));
        store.markDeleted("pear");

        assertEquals(List.of("apple"), store.fetchRandomWords(true, 5).join());
        assertEquals(2, store.fetchRandomWords(false, 5).join().size());
    }

    @Test
    @DisplayName("Empty pool should fail with a store exception")
    void testEmptyPool() {
        InMemoryWordStore store = new InMemoryWordStore(List.of("apple"));
        store.markDeleted("apple");

        CompletionException e = assertThrows(CompletionException.class,
                () -> store.fetchRandomWords(true, 3).join());
        assertInstanceOf(StoreException.class, e.getCause());
    }

    @Test
    @DisplayName("Word list file should be read one word per line")
    void testFromFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("words.txt");
        Files.write(file, List.of("# animals", "cat", "", "  dog  ", "cat"), StandardCharsets.UTF_8);

        InMemoryWordStore store = InMemoryWordStore.fromFile(file);

        assertEquals(2, store.size());
        store.addWord("emu");
        assertEquals(3, store.size());
    }

    @Test
    @DisplayName("Missing word list should raise a store exception")
    void testMissingList(@TempDir Path dir) {
        assertThrows(StoreException.class, () -> InMemoryWordStore.fromFile(dir.resolve("missing.txt")));
        assertThrows(StoreException.class, () -> InMemoryWordStore.fromClasspath("/no-such-words.txt"));
    }
}
