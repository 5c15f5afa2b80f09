package org.abstractica.rpcclient.impl.session;

import org.abstractica.rpcclient.EventLoop;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Event loop test double.
 *
 * <p>{@link #start()} runs the queued tasks and returns; it fails instead of
 * blocking when there is nothing to run. Calls to start and stop are recorded
 * in {@link #events()} together with any marker the test adds.</p>
 */
class RecordingLoop implements EventLoop
{
    private final Deque<Runnable> tasks = new ArrayDeque<>();
    private final List<String> events = new ArrayList<>();
    private final List<Runnable> periodic = new ArrayList<>();

    private int startCount;
    private int stopCount;

    @Override
    public void start()
    {
        startCount++;
        events.add("start");
        if (tasks.isEmpty())
        {
            throw new IllegalStateException("Loop started with nothing to run");
        }
        runPending();
    }

    @Override
    public void stop()
    {
        stopCount++;
        events.add("stop");
    }

    @Override
    public boolean isRunning()
    {
        return false;
    }

    @Override
    public void execute(Runnable task)
    {
        tasks.add(task);
    }

    @Override
    public Registration attachPeriodicCallback(Runnable callback, Duration interval)
    {
        periodic.add(callback);
        return () -> periodic.remove(callback);
    }

    void runPending()
    {
        while (!tasks.isEmpty())
        {
            tasks.poll().run();
        }
    }

    void mark(String event)
    {
        events.add(event);
    }

    List<String> events()
    {
        return events;
    }

    int startCount()
    {
        return startCount;
    }

    int stopCount()
    {
        return stopCount;
    }
}
