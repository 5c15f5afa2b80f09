package org.abstractica.rpcclient;

/**
 * Base class for failures delivered to RPC callers.
 *
 * <p>Unchecked, so blocking calls can surface failures without forcing every
 * call site to declare them.</p>
 */
public class RpcException extends RuntimeException
{
    /**
     * Creates an exception with a message.
     *
     * @param message the detail message
     */
    public RpcException(String message)
    {
        super(message);
    }

    /**
     * Creates an exception with a message and cause.
     *
     * @param message the detail message
     * @param cause   the underlying cause
     */
    public RpcException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
