package org.abstractica.rpcclient;

import java.util.List;

/**
 * Moves RPC messages between the session and the server.
 *
 * <p>The transport owns connection management, framing and encoding. Messages
 * are handed over in their array form, for example
 * {@code [REQUEST, msgid, method, args]}. Decoded responses and connection
 * failures are reported to the {@link TransportListener} the transport was
 * built with, on the session's event loop.</p>
 */
public interface ClientTransport extends AutoCloseable
{
    /**
     * Sends a message to the server.
     *
     * @param message the message in array form
     * @param onSent  called on the event loop once the message is written, or null
     */
    void sendMessage(List<Object> message, Runnable onSent);

    /**
     * Closes the connection and releases resources.
     */
    @Override
    void close();
}
