package org.abstractica.rpcclient;

/**
 * The server answered a request with a non-empty error field.
 *
 * <p>The error object is kept exactly as the transport decoded it.</p>
 */
public class RemoteCallException extends RpcException
{
    private final transient Object error;

    /**
     * Creates an exception carrying the server's error object.
     *
     * @param error the error returned by the server, never null
     */
    public RemoteCallException(Object error)
    {
        super("Remote error: " + error);
        this.error = error;
    }

    /**
     * Returns the error object returned by the server.
     *
     * @return the raw error value
     */
    public Object getError()
    {
        return error;
    }
}
