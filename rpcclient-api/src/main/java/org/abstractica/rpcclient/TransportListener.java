package org.abstractica.rpcclient;

/**
 * Receives inbound events from a {@link ClientTransport}.
 *
 * <p>Implemented by the session. Methods are invoked on the event loop.</p>
 */
public interface TransportListener
{
    /**
     * Called when a response message arrives.
     *
     * @param msgid  the message id the response answers
     * @param error  the error returned by the server, or null
     * @param result the result returned by the server
     */
    void onResponse(int msgid, Object error, Object result);

    /**
     * Called when the connection fails and will not recover.
     *
     * @param reason the failure
     */
    void onConnectFailed(TransportException reason);
}
