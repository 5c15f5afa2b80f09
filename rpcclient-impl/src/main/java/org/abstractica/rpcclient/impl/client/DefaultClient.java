package org.abstractica.rpcclient.impl.client;

import org.abstractica.rpcclient.EventLoop;
import org.abstractica.rpcclient.ResponseFuture;
import org.abstractica.rpcclient.RpcClient;
import org.abstractica.rpcclient.TransportBuilder;
import org.abstractica.rpcclient.TransportSettings;
import org.abstractica.rpcclient.handlers.ResultCallback;
import org.abstractica.rpcclient.impl.session.DefaultSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;

/**
 * Default implementation of the RpcClient interface.
 *
 * <p>Wraps a {@link DefaultSession} and, when a timeout is configured, runs
 * the session's timeout sweep once per second on the event loop.</p>
 */
public class DefaultClient implements RpcClient
{
    private static final Logger LOG = LoggerFactory.getLogger(DefaultClient.class);

    /**
     * Interval of the timeout sweep. Timeouts are counted in these ticks.
     */
    static final Duration SWEEP_INTERVAL = Duration.ofSeconds(1);

    private final DefaultSession session;
    private final EventLoop.Registration sweep;

    /**
     * Creates a new client.
     */
    DefaultClient(
            InetSocketAddress address,
            int timeoutSeconds,
            EventLoop loop,
            TransportBuilder transportBuilder,
            TransportSettings settings,
            boolean hostManagedLoop
    )
    {
        Objects.requireNonNull(loop, "loop");

        this.session = new DefaultSession(address, timeoutSeconds, loop, transportBuilder, settings, hostManagedLoop);
        this.sweep = (timeoutSeconds > 0)
                ? loop.attachPeriodicCallback(session::stepTimeout, SWEEP_INTERVAL)
                : null;

        LOG.info("Client for {} created (timeout={}s)", address, timeoutSeconds);
    }

    // ========== RpcClient Interface ==========

    @Override
    public Object call(String method, Object... args)
    {
        return session.call(method, args);
    }

    @Override
    public ResponseFuture callAsync(String method, Object... args)
    {
        return session.callAsync(method, args);
    }

    @Override
    public void callWithCallback(String method, ResultCallback callback, Object... args)
    {
        session.callWithCallback(method, callback, args);
    }

    @Override
    public void sendNotify(String method, Object... args)
    {
        session.sendNotify(method, args);
    }

    @Override
    public void close()
    {
        if (sweep != null)
        {
            sweep.cancel();
        }
        session.close();
    }

    @Override
    public InetSocketAddress getAddress()
    {
        return session.getAddress();
    }

    @Override
    public int pendingCount()
    {
        return session.pendingCount();
    }

    DefaultSession session()
    {
        return session;
    }
}
