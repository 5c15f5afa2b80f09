package org.abstractica.rpcclient.impl.loop;

import org.abstractica.rpcclient.EventLoop;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link DefaultEventLoop}.
 */
class DefaultEventLoopTest
{
    @Test
    void start_runsTasksInOrderUntilStopped()
    {
        DefaultEventLoop loop = new DefaultEventLoop();
        List<Integer> order = new ArrayList<>();

        loop.execute(() -> order.add(1));
        loop.execute(() -> order.add(2));
        loop.execute(loop::stop);
        loop.execute(() -> order.add(3));

        loop.start();

        assertEquals(List.of(1, 2), order);
        assertFalse(loop.isRunning());

        // Remaining task runs on the next start
        loop.execute(loop::stop);
        loop.start();
        assertEquals(List.of(1, 2, 3), order);
    }

    @Test
    void start_isRunningInsideTasks()
    {
        DefaultEventLoop loop = new DefaultEventLoop();
        List<Boolean> seen = new ArrayList<>();

        loop.execute(() ->
        {
            seen.add(loop.isRunning());
            loop.stop();
        });
        loop.start();

        assertEquals(List.of(true), seen);
    }

    @Test
    void start_reentrantCallReturnsImmediately()
    {
        DefaultEventLoop loop = new DefaultEventLoop();
        List<String> order = new ArrayList<>();

        loop.execute(() ->
        {
            loop.start();
            order.add("after nested start");
        });
        loop.execute(() ->
        {
            order.add("next task");
            loop.stop();
        });
        loop.start();

        assertEquals(List.of("after nested start", "next task"), order);
    }

    @Test
    void stop_whenIdleHasNoEffect()
    {
        DefaultEventLoop loop = new DefaultEventLoop();
        List<Integer> order = new ArrayList<>();

        loop.stop();
        loop.execute(() -> order.add(1));
        loop.execute(loop::stop);
        loop.start();

        assertEquals(List.of(1), order);
    }

    @Test
    void start_survivesThrowingTask()
    {
        DefaultEventLoop loop = new DefaultEventLoop();
        List<Integer> order = new ArrayList<>();

        loop.execute(() ->
        {
            throw new IllegalStateException("task bug");
        });
        loop.execute(() -> order.add(1));
        loop.execute(loop::stop);
        loop.start();

        assertEquals(List.of(1), order);
    }

    @Test
    void attachPeriodicCallback_runsRepeatedly()
    {
        DefaultEventLoop loop = new DefaultEventLoop();
        AtomicInteger ticks = new AtomicInteger();

        loop.attachPeriodicCallback(() ->
        {
            if (ticks.incrementAndGet() == 3)
            {
                loop.stop();
            }
        }, Duration.ofMillis(10));
        loop.start();

        assertEquals(3, ticks.get());
    }

    @Test
    void attachPeriodicCallback_cancelStopsRuns()
    {
        DefaultEventLoop loop = new DefaultEventLoop();
        AtomicInteger ticks = new AtomicInteger();
        EventLoop.Registration registration = loop.attachPeriodicCallback(ticks::incrementAndGet, Duration.ofMillis(5));

        registration.cancel();
        loop.attachPeriodicCallback(loop::stop, Duration.ofMillis(50));
        loop.start();

        assertEquals(0, ticks.get());
    }

    @Test
    void attachPeriodicCallback_rejectsNonPositiveInterval()
    {
        DefaultEventLoop loop = new DefaultEventLoop();

        assertThrows(IllegalArgumentException.class, () -> loop.attachPeriodicCallback(() -> {}, Duration.ZERO));
        assertThrows(IllegalArgumentException.class,
                () -> loop.attachPeriodicCallback(() -> {}, Duration.ofSeconds(-1)));
    }

    @Test
    void stop_fromAnotherThreadWakesIdleLoop() throws Exception
    {
        DefaultEventLoop loop = new DefaultEventLoop();
        CountDownLatch started = new CountDownLatch(1);
        loop.execute(started::countDown);

        Thread stopper = new Thread(() ->
        {
            try
            {
                started.await(5, TimeUnit.SECONDS);
                loop.stop();
            }
            catch (InterruptedException e)
            {
                Thread.currentThread().interrupt();
            }
        });
        stopper.start();

        loop.start();
        stopper.join(5000);

        assertFalse(loop.isRunning());
    }

    @Test
    void start_returnsWhenInterrupted()
    {
        DefaultEventLoop loop = new DefaultEventLoop();

        Thread.currentThread().interrupt();
        loop.start();

        // Clear the flag so later tests are unaffected
        assertTrue(Thread.interrupted());
        assertFalse(loop.isRunning());
    }
}
