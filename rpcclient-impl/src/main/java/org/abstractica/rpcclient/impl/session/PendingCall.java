package org.abstractica.rpcclient.impl.session;

import org.abstractica.rpcclient.handlers.ResultCallback;
import org.abstractica.rpcclient.impl.future.DefaultResponseFuture;

import java.util.Objects;

/**
 * An outstanding call waiting for its response.
 *
 * <p>Sealed so the response, timeout and failure paths handle both shapes
 * explicitly.</p>
 */
public sealed interface PendingCall
{
    /**
     * A call whose caller waits on a future.
     *
     * <p>Subject to timeouts and connection-failure broadcasts.</p>
     *
     * @param future the future completed by the response
     */
    record Awaiting(DefaultResponseFuture future) implements PendingCall
    {
        public Awaiting
        {
            Objects.requireNonNull(future, "future");
        }
    }

    /**
     * A call whose result goes to a callback.
     *
     * <p>Never timed out and not told about connection failures.</p>
     *
     * @param callback receives the result, or null on a remote error
     */
    record Callback(ResultCallback callback) implements PendingCall
    {
        public Callback
        {
            Objects.requireNonNull(callback, "callback");
        }
    }
}
