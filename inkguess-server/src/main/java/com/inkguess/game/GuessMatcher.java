package com.inkguess.game;

import java.util.Locale;

/**
 * Compares guesses with the secret word, ignoring case.
 */
public final class GuessMatcher {

    private GuessMatcher() {
    }

    public static boolean isExact(String guess, String word) {
        return guess != null && word != null && guess.trim().equalsIgnoreCase(word);
    }

    /**
     * Levenshtein distance between the lower-cased, trimmed strings.
     */
    public static int distance(String guess, String word) {
        String a = guess.trim().toLowerCase(Locale.ROOT);
        String b = word.toLowerCase(Locale.ROOT);

        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }
}
