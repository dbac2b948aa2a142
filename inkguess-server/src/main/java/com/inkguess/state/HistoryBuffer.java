package com.inkguess.state;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Bounded FIFO log replayed to late joiners. Appending to a full buffer evicts the
 * oldest entry.
 *
 * Not thread-safe; owned by the game loop.
 */
public class HistoryBuffer<T> {

    public static final int DRAW_CAPACITY = 1000;
    public static final int CHAT_CAPACITY = 20;

    private final int capacity;
    private final Deque<T> entries;

    public HistoryBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.entries = new ArrayDeque<>(Math.min(capacity, 64));
    }

    public void append(T entry) {
        while (entries.size() >= capacity) {
            entries.removeFirst();
        }
        entries.addLast(entry);
    }

    public void clear() {
        entries.clear();
    }

    /**
     * Entries oldest first.
     */
    public List<T> snapshot() {
        return new ArrayList<>(entries);
    }

    public int size() {
        return entries.size();
    }

    public int capacity() {
        return capacity;
    }
}
