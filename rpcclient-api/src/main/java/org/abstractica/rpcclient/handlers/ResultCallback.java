package org.abstractica.rpcclient.handlers;

/**
 * Receives the outcome of a callback-style call.
 *
 * <p>Callback calls carry no error detail: when the server answers with an
 * error the callback is invoked with {@code null}. Callers that need the error
 * object must use the future-based calls instead.</p>
 *
 * <p>Callback calls are never timed out and are not notified when the
 * connection fails. If no response arrives, the callback is never invoked.</p>
 */
@FunctionalInterface
public interface ResultCallback
{
    /**
     * Handles the result of a call.
     *
     * @param result the server's result, or null if the server returned an error
     */
    void onResult(Object result);
}
