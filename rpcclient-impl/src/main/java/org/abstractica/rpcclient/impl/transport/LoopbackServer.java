package org.abstractica.rpcclient.impl.transport;

import org.abstractica.rpcclient.ClientTransport;
import org.abstractica.rpcclient.EventLoop;
import org.abstractica.rpcclient.TransportBuilder;
import org.abstractica.rpcclient.TransportListener;
import org.abstractica.rpcclient.TransportSettings;
import org.abstractica.rpcclient.impl.protocol.RpcMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process RPC server reached through {@link LoopbackTransport}.
 *
 * <p>Serves registered methods directly, without sockets or encoding. Used for
 * tests and local development in place of a real wire transport.</p>
 *
 * <p>Usage:</p>
 * <pre>{@code
 * LoopbackServer server = new LoopbackServer();
 * server.register("add", args -> ((Number) args.get(0)).intValue() + ((Number) args.get(1)).intValue());
 *
 * RpcClient client = new DefaultClientFactory().builder()
 *     .address("localhost", 18800)
 *     .transportBuilder(server.transportBuilder())
 *     .build();
 * }</pre>
 */
public class LoopbackServer
{
    private static final Logger LOG = LoggerFactory.getLogger(LoopbackServer.class);

    private final Map<String, MethodHandler> methods;
    private final List<RpcMessage.Notify> notifications;
    private final List<LoopbackTransport> transports;

    /**
     * Creates a server with no methods.
     */
    public LoopbackServer()
    {
        this.methods = new ConcurrentHashMap<>();
        this.notifications = Collections.synchronizedList(new ArrayList<>());
        this.transports = Collections.synchronizedList(new ArrayList<>());
    }

    /**
     * Registers a method.
     *
     * @param method  the method name
     * @param handler serves calls to the method
     * @return this server
     */
    public LoopbackServer register(String method, MethodHandler handler)
    {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(handler, "handler");
        methods.put(method, handler);
        return this;
    }

    /**
     * Returns a transport builder connecting sessions to this server.
     *
     * @return the transport builder
     */
    public TransportBuilder transportBuilder()
    {
        return this::connect;
    }

    /**
     * Returns the transport most recently connected to this server.
     *
     * @return the transport
     * @throws IllegalStateException if nothing connected yet
     */
    public LoopbackTransport lastTransport()
    {
        synchronized (transports)
        {
            if (transports.isEmpty())
            {
                throw new IllegalStateException("No transport connected");
            }
            return transports.get(transports.size() - 1);
        }
    }

    /**
     * Returns the notifications received so far.
     *
     * @return a snapshot of received notifications, in arrival order
     */
    public List<RpcMessage.Notify> getNotifications()
    {
        synchronized (notifications)
        {
            return List.copyOf(notifications);
        }
    }

    // ========== Dispatch ==========

    ClientTransport connect(
            TransportListener listener,
            InetSocketAddress address,
            TransportSettings settings,
            EventLoop loop
    )
    {
        LOG.debug("Loopback connection for {} (reconnectLimit={})", address, settings.reconnectLimit());
        LoopbackTransport transport = new LoopbackTransport(this, listener, settings, loop);
        transports.add(transport);
        return transport;
    }

    RpcMessage.Response handle(RpcMessage.Request request)
    {
        MethodHandler handler = methods.get(request.method());
        if (handler == null)
        {
            return new RpcMessage.Response(request.msgid(), "Method not found: " + request.method(), null);
        }

        try
        {
            return new RpcMessage.Response(request.msgid(), null, handler.invoke(request.args()));
        }
        catch (Exception e)
        {
            LOG.debug("Method {} failed", request.method(), e);
            String error = (e.getMessage() != null) ? e.getMessage() : e.getClass().getSimpleName();
            return new RpcMessage.Response(request.msgid(), error, null);
        }
    }

    void handle(RpcMessage.Notify notify)
    {
        notifications.add(notify);

        MethodHandler handler = methods.get(notify.method());
        if (handler == null)
        {
            LOG.debug("No handler for notification {}", notify.method());
            return;
        }

        try
        {
            handler.invoke(notify.args());
        }
        catch (Exception e)
        {
            LOG.warn("Notification handler {} failed", notify.method(), e);
        }
    }
}
