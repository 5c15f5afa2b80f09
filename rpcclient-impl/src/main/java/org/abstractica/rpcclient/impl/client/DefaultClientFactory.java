package org.abstractica.rpcclient.impl.client;

import org.abstractica.rpcclient.EventLoop;
import org.abstractica.rpcclient.RpcClient;
import org.abstractica.rpcclient.RpcClientFactory;
import org.abstractica.rpcclient.TransportBuilder;
import org.abstractica.rpcclient.TransportSettings;
import org.abstractica.rpcclient.impl.loop.DefaultEventLoop;

import java.net.InetSocketAddress;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;

/**
 * Default implementation of RpcClientFactory.
 */
public class DefaultClientFactory implements RpcClientFactory
{
    /**
     * Timeout used when none is configured.
     */
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    @Override
    public Builder builder()
    {
        return new DefaultBuilder();
    }

    public static class DefaultBuilder implements Builder
    {
        private String host;
        private int port;
        private Duration timeout = DEFAULT_TIMEOUT;
        private int reconnectLimit = TransportSettings.DEFAULT_RECONNECT_LIMIT;
        private Charset packEncoding = StandardCharsets.UTF_8;
        private Charset unpackEncoding;
        private EventLoop loop; // Optional shared loop (defaults to a new DefaultEventLoop)
        private boolean hostManagedLoop;
        private TransportBuilder transportBuilder;

        @Override
        public Builder address(String host, int port)
        {
            this.host = Objects.requireNonNull(host, "host");
            if (port < 1 || port > 65535)
            {
                throw new IllegalArgumentException("Port must be 1-65535: " + port);
            }
            this.port = port;
            return this;
        }

        @Override
        public Builder timeout(Duration timeout)
        {
            Objects.requireNonNull(timeout, "timeout");
            if (timeout.isNegative())
            {
                throw new IllegalArgumentException("Timeout must be non-negative: " + timeout);
            }
            this.timeout = timeout;
            return this;
        }

        @Override
        public Builder reconnectLimit(int reconnectLimit)
        {
            if (reconnectLimit < 0)
            {
                throw new IllegalArgumentException("Reconnect limit must be non-negative: " + reconnectLimit);
            }
            this.reconnectLimit = reconnectLimit;
            return this;
        }

        @Override
        public Builder packEncoding(Charset encoding)
        {
            this.packEncoding = Objects.requireNonNull(encoding, "encoding");
            return this;
        }

        @Override
        public Builder unpackEncoding(Charset encoding)
        {
            this.unpackEncoding = encoding;
            return this;
        }

        @Override
        public Builder loop(EventLoop loop)
        {
            this.loop = Objects.requireNonNull(loop, "loop");
            return this;
        }

        @Override
        public Builder hostManagedLoop(boolean hostManaged)
        {
            this.hostManagedLoop = hostManaged;
            return this;
        }

        @Override
        public Builder transportBuilder(TransportBuilder transportBuilder)
        {
            this.transportBuilder = Objects.requireNonNull(transportBuilder, "transportBuilder");
            return this;
        }

        @Override
        public RpcClient build()
        {
            if (host == null || port == 0)
            {
                throw new IllegalStateException("Server address must be specified");
            }
            if (transportBuilder == null)
            {
                throw new IllegalStateException("Transport builder must be specified");
            }
            if (hostManagedLoop && loop == null)
            {
                throw new IllegalStateException("A host-managed loop must be specified");
            }

            InetSocketAddress address = new InetSocketAddress(host, port);
            TransportSettings settings = new TransportSettings(reconnectLimit, packEncoding, unpackEncoding);

            // Create loop (default to a private DefaultEventLoop)
            EventLoop eventLoop = (loop != null) ? loop : new DefaultEventLoop();

            return new DefaultClient(
                    address, toTimeoutSeconds(timeout), eventLoop, transportBuilder, settings, hostManagedLoop);
        }

        static int toTimeoutSeconds(Duration timeout)
        {
            long seconds = timeout.getSeconds() + (timeout.getNano() > 0 ? 1 : 0);
            if (seconds > Integer.MAX_VALUE)
            {
                throw new IllegalArgumentException("Timeout too large: " + timeout);
            }
            return (int) seconds;
        }
    }
}
