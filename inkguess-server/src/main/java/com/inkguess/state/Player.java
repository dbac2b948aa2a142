package com.inkguess.state;

/**
 * A player on the roster.
 *
 * Immutable: when the guessed flag changes a new Player replaces the old one.
 * The cumulative score is kept by {@link ScoreBoard}; the connection by the
 * session registry.
 */
public class Player {

    private final String name;
    private final boolean guessed;
    private final long joinedAt;

    public Player(String name, boolean guessed, long joinedAt) {
        this.name = name;
        this.guessed = guessed;
        this.joinedAt = joinedAt;
    }

    public static Player joined(String name) {
        return new Player(name, false, System.currentTimeMillis());
    }

    public String getName() {
        return name;
    }

    public boolean hasGuessed() {
        return guessed;
    }

    public long getJoinedAt() {
        return joinedAt;
    }

    public Player withGuessed(boolean newGuessed) {
        return new Player(name, newGuessed, joinedAt);
    }

    @Override
    public String toString() {
        return "Player{" +
                "name='" + name + '\'' +
                ", guessed=" + guessed +
                '}';
    }
}
