package org.abstractica.rpcclient;

import java.net.InetSocketAddress;

/**
 * Creates the transport a session sends its messages through.
 *
 * <p>Supplied through {@link RpcClientFactory.Builder#transportBuilder}, which
 * also makes it the seam for replacing the transport in tests.</p>
 */
@FunctionalInterface
public interface TransportBuilder
{
    /**
     * Creates a transport for a session.
     *
     * @param listener receives responses and connection failures
     * @param address  the server address
     * @param settings transport options, forwarded as configured
     * @param loop     the loop inbound events must be delivered on
     * @return a new transport
     */
    ClientTransport build(
            TransportListener listener,
            InetSocketAddress address,
            TransportSettings settings,
            EventLoop loop
    );
}
