package com.inkguess.store;

/**
 * A player account as seen by the game: name, last saved score and the game that
 * score belongs to.
 */
public class UserRecord {

    private final String identity;
    private final int score;
    private final String lastGameId;

    public UserRecord(String identity, int score, String lastGameId) {
        this.identity = identity;
        this.score = score;
        this.lastGameId = lastGameId;
    }

    public String getIdentity() {
        return identity;
    }

    public int getScore() {
        return score;
    }

    public String getLastGameId() {
        return lastGameId;
    }

    public UserRecord withScore(int newScore, String gameId) {
        return new UserRecord(identity, newScore, gameId);
    }

    @Override
    public String toString() {
        return "UserRecord{" +
                "identity='" + identity + '\'' +
                ", score=" + score +
                ", lastGameId='" + lastGameId + '\'' +
                '}';
    }
}
