package com.inkguess.state;

/**
 * Phases of the game session.
 */
public enum GamePhase {
    /** No game running; waiting for quorum or in the intermission between games. */
    IDLE,
    /** The drawer is picking one of the offered words. */
    CHOOSING_WORD,
    /** The drawer draws, everyone else guesses. */
    PLAYING,
    /** Short pause after a round before the next drawer is picked. */
    COOLDOWN
}
