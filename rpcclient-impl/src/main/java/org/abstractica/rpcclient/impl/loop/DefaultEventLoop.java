package org.abstractica.rpcclient.impl.loop;

import org.abstractica.rpcclient.EventLoop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Default implementation of EventLoop.
 *
 * <p>Runs on whichever thread calls {@link #start()}. Tasks handed over with
 * {@link #execute} run in submission order, interleaved with due periodic
 * callbacks. A task that throws is logged and the loop carries on.</p>
 */
public class DefaultEventLoop implements EventLoop
{
    private static final Logger LOG = LoggerFactory.getLogger(DefaultEventLoop.class);

    private static final Runnable WAKE_UP = () -> {};
    private static final long MAX_IDLE_NANOS = TimeUnit.MILLISECONDS.toNanos(100);

    private final BlockingQueue<Runnable> tasks;
    private final List<PeriodicTask> periodicTasks;

    private volatile boolean running;
    private volatile boolean stopRequested;

    /**
     * A periodic callback and its next due time.
     */
    private static final class PeriodicTask
    {
        private final Runnable callback;
        private final long intervalNanos;
        private long nextRunNanos;

        PeriodicTask(Runnable callback, long intervalNanos, long nextRunNanos)
        {
            this.callback = callback;
            this.intervalNanos = intervalNanos;
            this.nextRunNanos = nextRunNanos;
        }
    }

    /**
     * Creates an idle loop.
     */
    public DefaultEventLoop()
    {
        this.tasks = new LinkedBlockingQueue<>();
        this.periodicTasks = new CopyOnWriteArrayList<>();
    }

    @Override
    public void start()
    {
        if (running)
        {
            return;
        }

        running = true;
        stopRequested = false;

        try
        {
            while (!stopRequested)
            {
                long waitNanos = runDuePeriodicTasks(System.nanoTime());
                if (stopRequested)
                {
                    break;
                }

                Runnable task = tasks.poll(waitNanos, TimeUnit.NANOSECONDS);
                if (task != null)
                {
                    runTask(task);
                }
            }
        }
        catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
        }
        finally
        {
            running = false;
            stopRequested = false;
        }
    }

    @Override
    public void stop()
    {
        if (!running)
        {
            return;
        }
        stopRequested = true;
        tasks.offer(WAKE_UP);
    }

    @Override
    public boolean isRunning()
    {
        return running;
    }

    @Override
    public void execute(Runnable task)
    {
        Objects.requireNonNull(task, "task");
        tasks.add(task);
    }

    @Override
    public Registration attachPeriodicCallback(Runnable callback, Duration interval)
    {
        Objects.requireNonNull(callback, "callback");
        Objects.requireNonNull(interval, "interval");
        if (interval.isNegative() || interval.isZero())
        {
            throw new IllegalArgumentException("interval must be positive: " + interval);
        }

        long intervalNanos = interval.toNanos();
        PeriodicTask periodic = new PeriodicTask(callback, intervalNanos, System.nanoTime() + intervalNanos);
        periodicTasks.add(periodic);
        return () -> periodicTasks.remove(periodic);
    }

    // Returns how long the loop may wait for the next task.
    private long runDuePeriodicTasks(long nowNanos)
    {
        long waitNanos = MAX_IDLE_NANOS;

        for (PeriodicTask periodic : periodicTasks)
        {
            if (nowNanos - periodic.nextRunNanos >= 0)
            {
                periodic.nextRunNanos = nowNanos + periodic.intervalNanos;
                runTask(periodic.callback);
                if (stopRequested)
                {
                    return 0;
                }
            }
            waitNanos = Math.min(waitNanos, Math.max(0, periodic.nextRunNanos - nowNanos));
        }
        return waitNanos;
    }

    private void runTask(Runnable task)
    {
        try
        {
            task.run();
        }
        catch (Exception e)
        {
            LOG.error("Error in event loop task", e);
        }
    }
}
