package com.inkguess.game;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * Builds the masked form of the secret word and reveals letters over time.
 *
 * At most a third of the letters (rounded up) are ever revealed. Hints unlock as the
 * remaining time crosses evenly spaced marks inside the last {@link #HINT_WINDOW} units.
 */
public class HintGenerator {

    public static final int HINT_WINDOW = 30;
    public static final char PLACEHOLDER = '_';
    public static final char WIDE_SPACE = '\u2003';

    private final Random random;

    public HintGenerator() {
        this(new Random());
    }

    public HintGenerator(Random random) {
        this.random = random;
    }

    public String buildMask(String word, Set<Integer> revealed) {
        StringBuilder mask = new StringBuilder(word.length() * 2);
        for (int i = 0; i < word.length(); i++) {
            if (i > 0) {
                mask.append(' ');
            }
            char c = word.charAt(i);
            if (Character.isLetter(c)) {
                mask.append(revealed.contains(i) ? c : PLACEHOLDER);
            } else if (Character.isWhitespace(c)) {
                mask.append(WIDE_SPACE);
            } else {
                mask.append(c);
            }
        }
        return mask.toString();
    }

    /**
     * Returns a copy of {@code revealed} with one more random hidden letter, or an equal
     * copy when the hint limit is reached.
     */
    public Set<Integer> revealNext(String word, Set<Integer> revealed) {
        Set<Integer> next = new LinkedHashSet<>(revealed);
        if (revealed.size() >= maxHints(word)) {
            return next;
        }
        List<Integer> hidden = new ArrayList<>();
        for (int i = 0; i < word.length(); i++) {
            if (Character.isLetter(word.charAt(i)) && !revealed.contains(i)) {
                hidden.add(i);
            }
        }
        if (!hidden.isEmpty()) {
            next.add(hidden.get(random.nextInt(hidden.size())));
        }
        return next;
    }

    public int maxHints(String word) {
        return (letterCount(word) + 2) / 3;
    }

    public boolean shouldReveal(int remainingTime, int hintsShown, int maxHints) {
        if (maxHints <= 0 || hintsShown >= maxHints) {
            return false;
        }
        return remainingTime <= (double) HINT_WINDOW * (maxHints - hintsShown) / maxHints;
    }

    public static int letterCount(String word) {
        int count = 0;
        for (int i = 0; i < word.length(); i++) {
            if (Character.isLetter(word.charAt(i))) {
                count++;
            }
        }
        return count;
    }
}
