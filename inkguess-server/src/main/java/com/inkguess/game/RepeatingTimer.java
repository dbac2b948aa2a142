package com.inkguess.game;

/**
 * Tick bookkeeping shared by all scheduler implementations: counts elapsed units,
 * stops on the first tick returning true, runs the completion callback at most once.
 */
public class RepeatingTimer implements TimerHandle {

    private final TickCallback tick;
    private final Runnable onDone;

    private volatile boolean active = true;
    private volatile Runnable onStop;
    private int elapsed;

    public RepeatingTimer(TickCallback tick, Runnable onDone) {
        this.tick = tick;
        this.onDone = onDone;
    }

    /**
     * Delivers one tick. Does nothing once the timer stopped.
     */
    public void fire() {
        if (!active) {
            return;
        }
        boolean done = tick.onTick(elapsed++);
        // The tick may have cancelled this timer by starting another one
        if (done && active) {
            stop();
            onDone.run();
        }
    }

    @Override
    public void cancel() {
        if (active) {
            stop();
        }
    }

    @Override
    public boolean isActive() {
        return active;
    }

    public int getElapsed() {
        return elapsed;
    }

    /**
     * Registers the hook releasing the underlying scheduled task. Runs at once if the
     * timer already stopped.
     */
    public void onStop(Runnable hook) {
        this.onStop = hook;
        if (!active) {
            hook.run();
        }
    }

    private void stop() {
        active = false;
        Runnable hook = onStop;
        if (hook != null) {
            hook.run();
        }
    }
}
