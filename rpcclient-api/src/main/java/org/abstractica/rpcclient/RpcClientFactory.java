package org.abstractica.rpcclient;

import java.nio.charset.Charset;
import java.time.Duration;

/**
 * Factory for creating RpcClient instances.
 *
 * <p>Use the builder to configure the client before creation:</p>
 * <pre>{@code
 * RpcClientFactory factory = new DefaultClientFactory();
 * RpcClient client = factory.builder()
 *     .address("localhost", 18800)
 *     .timeout(Duration.ofSeconds(5))
 *     .transportBuilder(transportBuilder)
 *     .build();
 * }</pre>
 */
public interface RpcClientFactory
{
    /**
     * Creates a new client builder.
     *
     * @return a new builder instance
     */
    Builder builder();

    /**
     * Builder for configuring and creating an RpcClient.
     */
    interface Builder
    {
        /**
         * Sets the server address.
         *
         * @param host the server hostname or IP address
         * @param port the server port
         * @return this builder
         */
        Builder address(String host, int port);

        /**
         * Sets the per-call timeout.
         *
         * <p>Optional. Defaults to 10 seconds. Rounded up to whole seconds.
         * {@link Duration#ZERO} disables timeouts entirely.</p>
         *
         * @param timeout the timeout
         * @return this builder
         */
        Builder timeout(Duration timeout);

        /**
         * Sets the reconnection limit forwarded to the transport.
         *
         * @param reconnectLimit maximum reconnection attempts
         * @return this builder
         */
        Builder reconnectLimit(int reconnectLimit);

        /**
         * Sets the charset the transport encodes strings with.
         *
         * @param encoding the charset
         * @return this builder
         */
        Builder packEncoding(Charset encoding);

        /**
         * Sets the charset the transport decodes strings with.
         *
         * @param encoding the charset, or null to keep raw bytes
         * @return this builder
         */
        Builder unpackEncoding(Charset encoding);

        /**
         * Sets the event loop the client runs on.
         *
         * <p>Optional. Defaults to a new loop owned by the client.</p>
         *
         * @param loop the event loop
         * @return this builder
         */
        Builder loop(EventLoop loop);

        /**
         * Declares that the host application drives the loop itself.
         *
         * <p>The client then never starts or stops the loop, and blocking on
         * an incomplete future is not possible.</p>
         *
         * @param hostManaged true if the host drives the loop
         * @return this builder
         */
        Builder hostManagedLoop(boolean hostManaged);

        /**
         * Sets the builder for the client's transport.
         *
         * @param transportBuilder creates the transport
         * @return this builder
         */
        Builder transportBuilder(TransportBuilder transportBuilder);

        /**
         * Builds the client.
         *
         * @return the configured client
         * @throws IllegalStateException if required parameters are missing
         */
        RpcClient build();
    }
}
