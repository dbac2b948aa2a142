package com.inkguess.game;

/**
 * A running timer started by a {@link Scheduler}.
 */
public interface TimerHandle {

    /**
     * Stops tick delivery without running the completion callback. Idempotent.
     */
    void cancel();

    boolean isActive();
}
