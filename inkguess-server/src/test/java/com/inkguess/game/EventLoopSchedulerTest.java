package com.inkguess.game;

import io.netty.channel.DefaultEventLoop;
import org.junit.jupiter.api.*;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the scheduler on a real single-threaded loop with short ticks.
 */
@DisplayName("Event Loop Scheduler Tests")
class EventLoopSchedulerTest {

    private DefaultEventLoop loop;
    private EventLoopScheduler scheduler;

    @BeforeEach
    void setUp() {
        loop = new DefaultEventLoop();
        scheduler = new EventLoopScheduler(loop, 10);
    }

    @AfterEach
    void tearDown() throws Exception {
        loop.shutdownGracefully(0, 1, TimeUnit.SECONDS).sync();
    }

    @Test
    @DisplayName("Ticks should run on the loop until the callback says done")
    void testTicksUntilDone() throws Exception {
        List<Integer> ticks = new CopyOnWriteArrayList<>();
        CountDownLatch done = new CountDownLatch(1);

        TimerHandle handle = scheduler.start(elapsed -> {
            assertTrue(loop.inEventLoop());
            ticks.add(elapsed);
            return elapsed >= 3;
        }, done::countDown);

        assertTrue(done.await(5, TimeUnit.SECONDS));
        Thread.sleep(50);
        assertEquals(List.of(0, 1, 2, 3), ticks);
        assertFalse(handle.isActive());
    }

    @Test
    @DisplayName("Starting a timer should never tick synchronously")
    void testNoSynchronousTick() throws Exception {
        AtomicInteger ticks = new AtomicInteger();
        int seenDuringStart = loop.submit(() -> {
            scheduler.start(elapsed -> {
                ticks.incrementAndGet();
                return true;
            }, () -> { });
            return ticks.get();
        }).get(5, TimeUnit.SECONDS);

        assertEquals(0, seenDuringStart);
    }

    @Test
    @DisplayName("Cancelled timer should not complete")
    void testCancel() throws Exception {
        AtomicInteger done = new AtomicInteger();
        TimerHandle handle = scheduler.start(elapsed -> elapsed >= 1000, done::incrementAndGet);

        Thread.sleep(50);
        handle.cancel();
        assertFalse(handle.isActive());
        Thread.sleep(50);

        assertEquals(0, done.get());
    }

    @Test
    @DisplayName("A failing tick should be logged and the timer keep running")
    void testFailingTick() throws Exception {
        CountDownLatch done = new CountDownLatch(1);
        scheduler.start(elapsed -> {
            if (elapsed == 0) {
                throw new IllegalStateException("tick failure");
            }
            return elapsed >= 2;
        }, done::countDown);

        assertTrue(done.await(5, TimeUnit.SECONDS));
    }

    @Test
    @DisplayName("Tick interval must be positive")
    void testInvalidInterval() {
        assertThrows(IllegalArgumentException.class, () -> new EventLoopScheduler(loop, 0));
    }
}
