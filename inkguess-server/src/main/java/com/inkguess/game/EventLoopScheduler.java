package com.inkguess.game;

import io.netty.util.concurrent.EventExecutor;
import io.netty.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * {@link Scheduler} on a single-threaded Netty executor, the same one that runs
 * every other game event, so ticks never overlap with message handling.
 */
public class EventLoopScheduler implements Scheduler {

    private static final Logger logger = LoggerFactory.getLogger(EventLoopScheduler.class);

    private final EventExecutor executor;
    private final long tickMillis;

    public EventLoopScheduler(EventExecutor executor, long tickMillis) {
        if (tickMillis <= 0) {
            throw new IllegalArgumentException("Tick interval must be positive: " + tickMillis);
        }
        this.executor = executor;
        this.tickMillis = tickMillis;
    }

    @Override
    public TimerHandle start(TickCallback tick, Runnable onDone) {
        RepeatingTimer timer = new RepeatingTimer(tick, onDone);
        ScheduledFuture<?> future = executor.scheduleAtFixedRate(
                () -> fireSafely(timer), 0, tickMillis, TimeUnit.MILLISECONDS);
        timer.onStop(() -> future.cancel(false));
        return timer;
    }

    private void fireSafely(RepeatingTimer timer) {
        try {
            timer.fire();
        } catch (RuntimeException e) {
            // A throwing task would silently end scheduleAtFixedRate
            logger.error("Timer tick failed", e);
        }
    }

    public long getTickMillis() {
        return tickMillis;
    }
}
