package com.inkguess.game;

import java.util.ArrayList;
import java.util.List;

/**
 * Scheduler for tests: ticks are delivered only when the test calls {@link #tick()}.
 */
class ManualScheduler implements Scheduler {

    private final List<RepeatingTimer> started = new ArrayList<>();
    private RepeatingTimer current;

    @Override
    public TimerHandle start(TickCallback tick, Runnable onDone) {
        RepeatingTimer timer = new RepeatingTimer(tick, onDone);
        started.add(timer);
        current = timer;
        return timer;
    }

    /**
     * Fires one tick on the most recently started timer, if it is still running.
     */
    void tick() {
        if (current != null && current.isActive()) {
            current.fire();
        }
    }

    void advance(int ticks) {
        for (int i = 0; i < ticks; i++) {
            tick();
        }
    }

    long activeCount() {
        return started.stream().filter(RepeatingTimer::isActive).count();
    }

    int startedCount() {
        return started.size();
    }
}
