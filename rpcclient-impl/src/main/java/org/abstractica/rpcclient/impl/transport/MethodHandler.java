package org.abstractica.rpcclient.impl.transport;

import java.util.List;

/**
 * Serves one method of a {@link LoopbackServer}.
 */
@FunctionalInterface
public interface MethodHandler
{
    /**
     * Executes the method.
     *
     * @param args the call arguments
     * @return the result sent back to the caller
     * @throws Exception if the call fails; the message becomes the response's error
     */
    Object invoke(List<Object> args) throws Exception;
}
