package org.abstractica.rpcclient;

/**
 * No response arrived before the call's deadline elapsed.
 *
 * <p>The request may still reach the server and execute; the client only
 * stops waiting for it.</p>
 */
public class RpcTimeoutException extends RpcException
{
    /**
     * Creates a timeout exception.
     *
     * @param message the detail message
     */
    public RpcTimeoutException(String message)
    {
        super(message);
    }
}
