package org.abstractica.rpcclient.impl.future;

import org.abstractica.rpcclient.EventLoop;
import org.abstractica.rpcclient.RpcException;
import org.abstractica.rpcclient.ResponseFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Default implementation of ResponseFuture.
 *
 * <p>Single-assignment: the first {@link #setResult} or {@link #setError}
 * wins and later attempts return false. The deadline is counted in timeout
 * sweep ticks rather than wall-clock time, one tick per second.</p>
 *
 * <p>Not thread-safe. Completed and inspected on the session's loop.</p>
 */
public class DefaultResponseFuture implements ResponseFuture
{
    private static final Logger LOG = LoggerFactory.getLogger(DefaultResponseFuture.class);

    private final EventLoop loop;
    private final boolean expires;
    private final List<Consumer<ResponseFuture>> callbacks;

    private int remainingTicks;
    private boolean done;
    private Object result;
    private RpcException error;

    /**
     * Creates a pending future.
     *
     * @param loop           the loop {@link #join()} drives, or null if the host drives it
     * @param timeoutSeconds sweep ticks before expiry, 0 for no timeout
     */
    public DefaultResponseFuture(EventLoop loop, int timeoutSeconds)
    {
        if (timeoutSeconds < 0)
        {
            throw new IllegalArgumentException("timeoutSeconds must be non-negative: " + timeoutSeconds);
        }
        this.loop = loop;
        this.expires = timeoutSeconds > 0;
        this.remainingTicks = timeoutSeconds;
        this.callbacks = new ArrayList<>();
    }

    @Override
    public void join()
    {
        while (!done)
        {
            if (loop == null)
            {
                throw new IllegalStateException(
                        "Cannot wait on a host-managed loop; attach a callback instead");
            }
            if (loop.isRunning())
            {
                throw new IllegalStateException("Cannot wait for a response from inside the event loop");
            }

            loop.start();

            if (!done && Thread.currentThread().isInterrupted())
            {
                throw new RpcException("Interrupted while waiting for response");
            }
        }
    }

    @Override
    public Object get()
    {
        join();
        if (error != null)
        {
            throw error;
        }
        return result;
    }

    @Override
    public boolean isDone()
    {
        return done;
    }

    @Override
    public Object getResult()
    {
        return result;
    }

    @Override
    public RpcException getError()
    {
        return error;
    }

    @Override
    public void attachCallback(Consumer<ResponseFuture> callback)
    {
        Objects.requireNonNull(callback, "callback");
        if (done)
        {
            runCallback(callback);
        }
        else
        {
            callbacks.add(callback);
        }
    }

    /**
     * Completes the future with a result.
     *
     * @param value the result (may be null)
     * @return true if this call completed the future, false if it was already complete
     */
    public boolean setResult(Object value)
    {
        return complete(value, null);
    }

    /**
     * Completes the future with a failure.
     *
     * @param failure the failure
     * @return true if this call completed the future, false if it was already complete
     */
    public boolean setError(RpcException failure)
    {
        Objects.requireNonNull(failure, "failure");
        return complete(null, failure);
    }

    /**
     * Advances the deadline by one sweep tick.
     *
     * @return true if the deadline has elapsed
     */
    public boolean stepTimeout()
    {
        if (!expires)
        {
            return false;
        }
        if (remainingTicks < 1)
        {
            return true;
        }
        remainingTicks--;
        return false;
    }

    private boolean complete(Object value, RpcException failure)
    {
        if (done)
        {
            LOG.debug("Ignoring second completion of future");
            return false;
        }

        this.result = value;
        this.error = failure;
        this.done = true;

        for (Consumer<ResponseFuture> callback : callbacks)
        {
            runCallback(callback);
        }
        callbacks.clear();
        return true;
    }

    private void runCallback(Consumer<ResponseFuture> callback)
    {
        try
        {
            callback.accept(this);
        }
        catch (Exception e)
        {
            LOG.error("Future callback error", e);
        }
    }
}
