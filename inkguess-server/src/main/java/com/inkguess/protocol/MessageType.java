package com.inkguess.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Defines all message types of the game protocol.
 *
 * Client → Server:
 * - HANDSHAKE: Authenticate with a login token
 * - DRAW: A stroke or a canvas clear
 * - CHAT: Chat line, also evaluated as a guess
 * - WORD: The drawer's pick among the offered words
 *
 * Server → Client:
 * - HANDSHAKE: Confirms the resolved player name
 * - DRAW / CHAT: Relayed events and history replay
 * - WORD_CHOICES: Candidate words, sent to the drawer only
 * - START_ROUND: Drawer name, word or hint, round number
 * - END_ROUND: The word and the round ledger
 * - PLAYER: Score and guessed flag of one player
 * - PLAYER_DISCONNECTED: A player left
 * - TIMER: Remaining time of the running countdown
 * - WORD: Updated hint for guessers
 * - GAME_OVER: The game ended
 * - ERROR: Error notification
 *
 * The wire name of each type is its {@link JsonProperty} value.
 */
public enum MessageType {
    @JsonProperty("handshake")
    HANDSHAKE,
    @JsonProperty("draw")
    DRAW,
    @JsonProperty("chat")
    CHAT,
    @JsonProperty("word-choices")
    WORD_CHOICES,
    @JsonProperty("start-round")
    START_ROUND,
    @JsonProperty("end-round")
    END_ROUND,
    @JsonProperty("player")
    PLAYER,
    @JsonProperty("player-disconnected")
    PLAYER_DISCONNECTED,
    @JsonProperty("timer")
    TIMER,
    @JsonProperty("word")
    WORD,
    @JsonProperty("game-over")
    GAME_OVER,
    @JsonProperty("error")
    ERROR
}
