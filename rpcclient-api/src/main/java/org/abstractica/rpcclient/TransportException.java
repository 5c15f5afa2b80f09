package org.abstractica.rpcclient;

/**
 * The transport reported that the connection failed.
 *
 * <p>A single connection failure is delivered to every outstanding
 * future-based call of the session.</p>
 */
public class TransportException extends RpcException
{
    /**
     * Creates a transport exception.
     *
     * @param message the failure description
     */
    public TransportException(String message)
    {
        super(message);
    }

    /**
     * Creates a transport exception with an underlying cause.
     *
     * @param message the failure description
     * @param cause   the underlying I/O failure
     */
    public TransportException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
