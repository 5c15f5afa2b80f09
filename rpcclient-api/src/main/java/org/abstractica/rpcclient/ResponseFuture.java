package org.abstractica.rpcclient;

import java.util.function.Consumer;

/**
 * The pending outcome of an asynchronous call.
 *
 * <p>A future is completed exactly once, either with the server's result or
 * with an {@link RpcException}. Later completion attempts are ignored.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * ResponseFuture sum = client.callAsync("add", 2, 3);
 * ResponseFuture product = client.callAsync("mul", 2, 3);
 * Object a = sum.get();
 * Object b = product.get();
 * }</pre>
 */
public interface ResponseFuture
{
    /**
     * Waits until the future is completed.
     *
     * <p>Waiting is cooperative: the calling thread drives the session's event
     * loop, so other calls' replies and timeouts keep being serviced.</p>
     *
     * @throws IllegalStateException if the future is incomplete and the session
     *                               runs on a host-managed loop it may not drive
     */
    void join();

    /**
     * Waits for completion and returns the result.
     *
     * @return the server's result (may be null)
     * @throws RemoteCallException  if the server returned an error
     * @throws RpcTimeoutException  if the call timed out
     * @throws TransportException   if the connection failed
     */
    Object get();

    /**
     * Returns whether the future has been completed.
     *
     * @return true once a result or an error is set
     */
    boolean isDone();

    /**
     * Returns the result without waiting.
     *
     * @return the result, or null if incomplete or failed
     */
    Object getResult();

    /**
     * Returns the failure without waiting.
     *
     * @return the error, or null if incomplete or successful
     */
    RpcException getError();

    /**
     * Registers a callback invoked once the future completes.
     *
     * <p>If the future is already complete the callback runs immediately.</p>
     *
     * @param callback called with this future
     */
    void attachCallback(Consumer<ResponseFuture> callback);
}
