package org.abstractica.rpcclient.impl.session;

import org.abstractica.rpcclient.ClientTransport;
import org.abstractica.rpcclient.EventLoop;
import org.abstractica.rpcclient.RemoteCallException;
import org.abstractica.rpcclient.RpcTimeoutException;
import org.abstractica.rpcclient.TransportBuilder;
import org.abstractica.rpcclient.TransportException;
import org.abstractica.rpcclient.TransportListener;
import org.abstractica.rpcclient.TransportSettings;
import org.abstractica.rpcclient.handlers.ResultCallback;
import org.abstractica.rpcclient.impl.future.DefaultResponseFuture;
import org.abstractica.rpcclient.impl.protocol.RpcMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Correlates requests and responses over one transport connection.
 *
 * <p>Each request gets a fresh message id and a record in the pending-call
 * registry. The response carrying that id removes the record and completes
 * the call. Calls waiting on a future are failed when the timeout sweep finds
 * their deadline elapsed, or when the transport reports a connection
 * failure.</p>
 *
 * <p>The session assumes a single cooperative loop drives it and uses no
 * locking. The registry is never modified while a delivery is in progress:
 * every mutation happens inside one loop task.</p>
 */
public class DefaultSession implements TransportListener
{
    private static final Logger LOG = LoggerFactory.getLogger(DefaultSession.class);

    private static final String TIMEOUT_MESSAGE = "Request timed out";

    private final InetSocketAddress address;
    private final int timeoutSeconds;
    private final EventLoop loop;
    private final boolean hostManagedLoop;
    private final MessageIdGenerator generator;
    private final PendingCallRegistry registry;

    private ClientTransport transport;

    /**
     * Creates a session and its transport.
     *
     * @param address          the server address
     * @param timeoutSeconds   per-call timeout in sweep ticks, 0 to disable
     * @param loop             the loop driving the session
     * @param transportBuilder creates the transport
     * @param settings         options forwarded to the transport
     * @param hostManagedLoop  true if the host starts and stops the loop itself
     */
    public DefaultSession(
            InetSocketAddress address,
            int timeoutSeconds,
            EventLoop loop,
            TransportBuilder transportBuilder,
            TransportSettings settings,
            boolean hostManagedLoop
    )
    {
        this.address = Objects.requireNonNull(address, "address");
        this.loop = Objects.requireNonNull(loop, "loop");
        Objects.requireNonNull(transportBuilder, "transportBuilder");
        Objects.requireNonNull(settings, "settings");
        if (timeoutSeconds < 0)
        {
            throw new IllegalArgumentException("timeoutSeconds must be non-negative: " + timeoutSeconds);
        }

        this.timeoutSeconds = timeoutSeconds;
        this.hostManagedLoop = hostManagedLoop;
        this.generator = new MessageIdGenerator();
        this.registry = new PendingCallRegistry();
        this.transport = Objects.requireNonNull(
                transportBuilder.build(this, address, settings, loop), "transport");
    }

    // ========== Calls ==========

    /**
     * Calls a remote method and waits for the result.
     *
     * @param method the method name
     * @param args   the arguments
     * @return the server's result
     * @throws IllegalStateException if called on a host-managed loop or from
     *                               inside the running loop; nothing is sent
     */
    public Object call(String method, Object... args)
    {
        if (hostManagedLoop)
        {
            throw new IllegalStateException(
                    "Cannot block on a host-managed loop; use callAsync or callWithCallback");
        }
        if (loop.isRunning())
        {
            throw new IllegalStateException("Cannot block for a response from inside the event loop");
        }
        return sendRequest(method, args).get();
    }

    /**
     * Calls a remote method and returns the pending future.
     *
     * @param method the method name
     * @param args   the arguments
     * @return the future
     */
    public DefaultResponseFuture callAsync(String method, Object... args)
    {
        return sendRequest(method, args);
    }

    /**
     * Calls a remote method, delivering the result to a callback.
     *
     * @param method   the method name
     * @param callback receives the result, or null on a remote error
     * @param args     the arguments
     */
    public void callWithCallback(String method, ResultCallback callback, Object... args)
    {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(callback, "callback");
        ClientTransport t = requireOpen();

        int msgid = generator.next();
        registry.register(msgid, new PendingCall.Callback(callback));
        send(t, msgid, new RpcMessage.Request(msgid, method, RpcMessage.arguments(args)));
    }

    /**
     * Sends a notification and drives the loop until the transport wrote it.
     *
     * @param method the method name
     * @param args   the arguments
     */
    public void sendNotify(String method, Object... args)
    {
        Objects.requireNonNull(method, "method");
        ClientTransport t = requireOpen();

        AtomicBoolean flushed = new AtomicBoolean(false);
        LOG.debug("Sending notify {}", method);
        t.sendMessage(new RpcMessage.Notify(method, RpcMessage.arguments(args)).toArray(), () ->
        {
            flushed.set(true);
            stopLoop();
        });

        if (hostManagedLoop || loop.isRunning())
        {
            return;
        }

        // A connection failure closes the session without flushing
        while (!flushed.get() && transport != null)
        {
            loop.start();
            if (Thread.currentThread().isInterrupted())
            {
                break;
            }
        }
    }

    /**
     * Closes the transport and forgets every outstanding call.
     *
     * <p>Futures still pending are not completed. Calling close again has no
     * effect.</p>
     */
    public void close()
    {
        if (transport != null)
        {
            ClientTransport t = transport;
            transport = null;
            t.close();
            LOG.info("Session to {} closed, abandoning {} pending calls", address, registry.size());
        }
        registry.clear();
    }

    // ========== Transport Events ==========

    @Override
    public void onResponse(int msgid, Object error, Object result)
    {
        PendingCall call = registry.remove(msgid);
        if (call == null)
        {
            // Late reply to a timed-out call, or an id we never issued
            LOG.debug("Discarding response for unknown message id {}", msgid);
            return;
        }

        if (call instanceof PendingCall.Awaiting awaiting)
        {
            if (error != null)
            {
                awaiting.future().setError(new RemoteCallException(error));
            }
            else
            {
                awaiting.future().setResult(result);
            }
        }
        else if (call instanceof PendingCall.Callback callback)
        {
            safeCallback(callback.callback(), error != null ? null : result);
        }

        stopLoop();
    }

    @Override
    public void onConnectFailed(TransportException reason)
    {
        Objects.requireNonNull(reason, "reason");

        List<PendingCallRegistry.AwaitingEntry> failed = registry.removeAwaiting();
        LOG.warn("Connection to {} failed, failing {} pending calls: {}",
                address, failed.size(), reason.getMessage());

        // Close first: callbacks run by setError must see a closed session
        close();
        for (PendingCallRegistry.AwaitingEntry entry : failed)
        {
            entry.future().setError(reason);
        }
        stopLoop();
    }

    // ========== Timeouts ==========

    /**
     * Advances every awaiting call's deadline by one tick and fails the expired ones.
     *
     * <p>Callback calls are not affected. The loop is stopped before any
     * record is removed, so the caller blocked in a future's join wakes up and
     * restarts the loop if it is still waiting.</p>
     */
    public void stepTimeout()
    {
        List<Integer> expired = new ArrayList<>();
        for (PendingCallRegistry.AwaitingEntry entry : registry.awaiting())
        {
            if (entry.future().stepTimeout())
            {
                expired.add(entry.msgid());
            }
        }

        if (expired.isEmpty())
        {
            return;
        }

        stopLoop();
        for (int msgid : expired)
        {
            PendingCall call = registry.remove(msgid);
            if (call instanceof PendingCall.Awaiting awaiting)
            {
                LOG.warn("Request {} to {} timed out", msgid, address);
                awaiting.future().setError(new RpcTimeoutException(TIMEOUT_MESSAGE));
            }
        }
    }

    // ========== Accessors ==========

    /**
     * Returns the server address.
     *
     * @return the address
     */
    public InetSocketAddress getAddress()
    {
        return address;
    }

    /**
     * Returns the number of outstanding calls.
     *
     * @return future-based and callback-based calls combined
     */
    public int pendingCount()
    {
        return registry.size();
    }

    /**
     * Returns whether the session has been closed.
     *
     * @return true after close or a connection failure
     */
    public boolean isClosed()
    {
        return transport == null;
    }

    PendingCallRegistry registry()
    {
        return registry;
    }

    // ========== Helpers ==========

    private DefaultResponseFuture sendRequest(String method, Object[] args)
    {
        Objects.requireNonNull(method, "method");
        ClientTransport t = requireOpen();

        int msgid = generator.next();
        DefaultResponseFuture future = new DefaultResponseFuture(hostManagedLoop ? null : loop, timeoutSeconds);
        registry.register(msgid, new PendingCall.Awaiting(future));
        send(t, msgid, new RpcMessage.Request(msgid, method, RpcMessage.arguments(args)));
        return future;
    }

    private void send(ClientTransport t, int msgid, RpcMessage.Request request)
    {
        LOG.debug("Sending request {} {}", msgid, request.method());
        try
        {
            t.sendMessage(request.toArray(), null);
        }
        catch (RuntimeException e)
        {
            registry.remove(msgid);
            throw e;
        }
    }

    private ClientTransport requireOpen()
    {
        if (transport == null)
        {
            throw new IllegalStateException("Session to " + address + " is closed");
        }
        return transport;
    }

    private void stopLoop()
    {
        if (!hostManagedLoop)
        {
            loop.stop();
        }
    }

    private void safeCallback(ResultCallback callback, Object result)
    {
        try
        {
            callback.onResult(result);
        }
        catch (Exception e)
        {
            LOG.error("Result callback error", e);
        }
    }
}
