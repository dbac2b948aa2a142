package com.inkguess.game;

/**
 * Repeating timers driving every time-based transition of the game.
 *
 * The first tick arrives on a later turn of the game loop, never inside {@code start},
 * then one tick per time unit. When the tick callback returns true the timer stops and
 * {@code onDone} runs exactly once. A cancelled timer never runs {@code onDone}.
 */
public interface Scheduler {

    TimerHandle start(TickCallback tick, Runnable onDone);
}
