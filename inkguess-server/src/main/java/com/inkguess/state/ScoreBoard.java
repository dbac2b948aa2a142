package com.inkguess.state;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Cumulative scores plus the ledger of the current round.
 *
 * Guesser payout: {@code 10 + min(30, round(remaining * 0.5)) + bonus + (first ? 4 : 0)}.
 * The bonus starts at 6 every round and drops by one per correct guess, without a floor.
 * Drawer payout scales the first guesser's payout by the share of players who guessed,
 * or is a flat -10 when nobody did.
 */
public class ScoreBoard {

    public static final int BASE_SCORE = 10;
    public static final int MAX_TIME_SCORE = 30;
    public static final double TIME_FACTOR = 0.5;
    public static final int INITIAL_BONUS = 6;
    public static final int FIRST_GUESS_BONUS = 4;
    public static final int DRAWER_PENALTY = -10;

    private final Map<String, Integer> totals = new LinkedHashMap<>();
    private final Map<String, Integer> roundLedger = new LinkedHashMap<>();

    private int bonus = INITIAL_BONUS;
    private int winnerScore;
    private int correctGuesses;

    public void resetForGame(Collection<String> players) {
        totals.clear();
        for (String player : players) {
            totals.put(player, 0);
        }
    }

    public void beginRound(Collection<String> roster) {
        roundLedger.clear();
        for (String player : roster) {
            roundLedger.put(player, 0);
            totals.putIfAbsent(player, 0);
        }
        bonus = INITIAL_BONUS;
        winnerScore = 0;
        correctGuesses = 0;
    }

    /**
     * Adds a zero ledger entry for a player joining mid-round.
     */
    public void addToRound(String player) {
        roundLedger.putIfAbsent(player, 0);
        totals.putIfAbsent(player, 0);
    }

    public void creditRound(String player, int delta) {
        totals.merge(player, delta, Integer::sum);
        roundLedger.merge(player, delta, Integer::sum);
    }

    /**
     * Computes and credits the payout for a correct guess.
     *
     * @return the payout
     */
    public int scoreGuess(String player, int remainingTime) {
        boolean first = correctGuesses == 0;
        int timeScore = Math.min(MAX_TIME_SCORE, (int) Math.round(remainingTime * TIME_FACTOR));
        int score = BASE_SCORE + timeScore + bonus + (first ? FIRST_GUESS_BONUS : 0);

        if (first) {
            winnerScore = score;
        }
        bonus--;
        correctGuesses++;
        creditRound(player, score);
        return score;
    }

    public int drawerPayout(int guessedCount, int totalGuessers) {
        if (guessedCount > 0 && totalGuessers > 0) {
            return (int) Math.round((double) winnerScore * guessedCount / totalGuessers);
        }
        return DRAWER_PENALTY;
    }

    /**
     * Sets a cumulative score, used when a player reconnects to the same game.
     */
    public void restore(String player, int score) {
        totals.put(player, score);
    }

    public void remove(String player) {
        totals.remove(player);
    }

    public int total(String player) {
        return totals.getOrDefault(player, 0);
    }

    public boolean has(String player) {
        return totals.containsKey(player);
    }

    public Map<String, Integer> totals() {
        return Collections.unmodifiableMap(totals);
    }

    public Map<String, Integer> roundLedger() {
        return Collections.unmodifiableMap(roundLedger);
    }

    /**
     * Highest cumulative score, first entry wins ties; null when empty.
     */
    public String leader() {
        String leader = null;
        int best = Integer.MIN_VALUE;
        for (Map.Entry<String, Integer> entry : totals.entrySet()) {
            if (entry.getValue() > best) {
                best = entry.getValue();
                leader = entry.getKey();
            }
        }
        return leader;
    }

    public int getBonus() {
        return bonus;
    }

    public int getWinnerScore() {
        return winnerScore;
    }

    public int getCorrectGuesses() {
        return correctGuesses;
    }
}
