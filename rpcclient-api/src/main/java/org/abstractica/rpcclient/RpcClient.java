package org.abstractica.rpcclient;

import org.abstractica.rpcclient.handlers.ResultCallback;

import java.net.InetSocketAddress;

/**
 * A client issuing RPC calls over one persistent connection.
 *
 * <p>Any number of calls may be outstanding at once. Each request is tagged
 * with a message id and the reply carrying the same id completes it. Calls
 * that receive no reply within the configured timeout fail with
 * {@link RpcTimeoutException}.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * try (RpcClient client = clientFactory.builder()
 *         .address("localhost", 18800)
 *         .timeout(Duration.ofSeconds(10))
 *         .transportBuilder(transportBuilder)
 *         .build())
 * {
 *     Object sum = client.call("add", 2, 3);
 *     client.sendNotify("log", "added");
 * }
 * }</pre>
 *
 * <p>Not thread-safe. A client is driven by a single cooperative event loop;
 * callers on other threads must synchronize externally.</p>
 */
public interface RpcClient extends AutoCloseable
{
    /**
     * Calls a remote method and waits for its result.
     *
     * @param method the method name
     * @param args   the arguments
     * @return the server's result
     * @throws RemoteCallException  if the server returned an error
     * @throws RpcTimeoutException  if no reply arrived in time
     * @throws TransportException   if the connection failed
     * @throws IllegalStateException if the client is closed
     */
    Object call(String method, Object... args);

    /**
     * Calls a remote method without waiting.
     *
     * @param method the method name
     * @param args   the arguments
     * @return a future completed by the reply, a timeout or a connection failure
     * @throws IllegalStateException if the client is closed
     */
    ResponseFuture callAsync(String method, Object... args);

    /**
     * Calls a remote method and hands the result to a callback.
     *
     * <p>The callback receives null if the server returned an error. It is
     * never timed out and is not notified of connection failures.</p>
     *
     * @param method   the method name
     * @param callback receives the result
     * @param args     the arguments
     * @throws IllegalStateException if the client is closed
     */
    void callWithCallback(String method, ResultCallback callback, Object... args);

    /**
     * Sends a notification, for which the server sends no reply.
     *
     * <p>Returns once the transport has written the message.</p>
     *
     * @param method the method name
     * @param args   the arguments
     * @throws IllegalStateException if the client is closed
     */
    void sendNotify(String method, Object... args);

    /**
     * Closes the client and its connection.
     *
     * <p>Futures still pending are abandoned and will never complete.</p>
     */
    @Override
    void close();

    /**
     * Returns the server address.
     *
     * @return the address the client was built for
     */
    InetSocketAddress getAddress();

    /**
     * Returns the number of calls awaiting a reply.
     *
     * @return outstanding future-based and callback-based calls
     */
    int pendingCount();
}
