package com.inkguess.state;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * State of the round in progress, from drawer selection to the end of the round.
 */
public class RoundState {

    private final String drawer;
    private final int roundNumber;

    private List<String> candidates = Collections.emptyList();
    private String word;
    private Set<Integer> hintsShown = new LinkedHashSet<>();
    private final Set<String> guessers = new LinkedHashSet<>();
    private String mask;
    private int guessingTime;
    private int remainingTime;

    public RoundState(String drawer, int roundNumber) {
        this.drawer = drawer;
        this.roundNumber = roundNumber;
    }

    public String getDrawer() {
        return drawer;
    }

    public boolean isDrawer(String identity) {
        return drawer.equals(identity);
    }

    public int getRoundNumber() {
        return roundNumber;
    }

    public List<String> getCandidates() {
        return candidates;
    }

    public void setCandidates(List<String> candidates) {
        this.candidates = List.copyOf(candidates);
    }

    /**
     * Finds the offered word matching {@code choice} case-insensitively.
     *
     * @return the candidate as offered, or null
     */
    public String matchCandidate(String choice) {
        if (choice == null) {
            return null;
        }
        String trimmed = choice.trim();
        for (String candidate : candidates) {
            if (candidate.equalsIgnoreCase(trimmed)) {
                return candidate;
            }
        }
        return null;
    }

    public String getWord() {
        return word;
    }

    public boolean hasWord() {
        return word != null;
    }

    public void setWord(String word) {
        this.word = word;
    }

    public Set<Integer> getHintsShown() {
        return Collections.unmodifiableSet(hintsShown);
    }

    /**
     * Replaces the revealed set; the new set must contain the old one.
     */
    public void setHintsShown(Set<Integer> revealed) {
        if (!revealed.containsAll(hintsShown)) {
            throw new IllegalArgumentException("Revealed letters cannot be hidden again");
        }
        this.hintsShown = new LinkedHashSet<>(revealed);
    }

    /**
     * Records a correct guess. Survives the guesser leaving, so a reconnect within
     * the same round cannot score again.
     */
    public void markGuessed(String identity) {
        guessers.add(identity);
    }

    public boolean hasGuessed(String identity) {
        return guessers.contains(identity);
    }

    public Set<String> getGuessers() {
        return Collections.unmodifiableSet(guessers);
    }

    public String getMask() {
        return mask;
    }

    public void setMask(String mask) {
        this.mask = mask;
    }

    public int getGuessingTime() {
        return guessingTime;
    }

    public void setGuessingTime(int guessingTime) {
        this.guessingTime = guessingTime;
    }

    public int getRemainingTime() {
        return remainingTime;
    }

    public void setRemainingTime(int remainingTime) {
        this.remainingTime = remainingTime;
    }

    @Override
    public String toString() {
        return "RoundState{" +
                "drawer='" + drawer + '\'' +
                ", round=" + roundNumber +
                ", hints=" + hintsShown.size() +
                ", remaining=" + remainingTime +
                '}';
    }
}
