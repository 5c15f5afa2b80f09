package org.abstractica.rpcclient;

import java.time.Duration;

/**
 * A single-threaded cooperative scheduler.
 *
 * <p>Transport I/O completions, periodic callbacks and blocking calls all run
 * on the thread that called {@link #start()}. Only one task runs at a time,
 * which is why sessions driven by a loop need no locking.</p>
 */
public interface EventLoop
{
    /**
     * Runs tasks on the calling thread until {@link #stop()} is called.
     *
     * <p>Returns immediately if the loop is already running.</p>
     */
    void start();

    /**
     * Makes the running {@link #start()} return after the current task.
     *
     * <p>Has no effect when the loop is not running.</p>
     */
    void stop();

    /**
     * Returns whether {@link #start()} is currently executing.
     *
     * @return true while the loop runs
     */
    boolean isRunning();

    /**
     * Queues a task to run on the loop.
     *
     * <p>This method is thread-safe and may be called from any thread.</p>
     *
     * @param task the task to run
     */
    void execute(Runnable task);

    /**
     * Schedules a callback to run repeatedly while the loop runs.
     *
     * @param callback the callback to run
     * @param interval time between runs
     * @return handle for cancelling the callback
     */
    Registration attachPeriodicCallback(Runnable callback, Duration interval);

    /**
     * Handle for a periodic callback.
     */
    @FunctionalInterface
    interface Registration
    {
        /**
         * Stops further runs of the callback.
         */
        void cancel();
    }
}
