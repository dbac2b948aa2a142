package com.inkguess.game;

/**
 * Called once per tick of a {@link Scheduler} timer.
 */
@FunctionalInterface
public interface TickCallback {

    /**
     * @param elapsed whole time units since the timer started, 0 on the first tick
     * @return true to stop the timer and run its completion callback
     */
    boolean onTick(int elapsed);
}
