package org.abstractica.rpcclient.impl.transport;

import org.abstractica.rpcclient.ClientTransport;
import org.abstractica.rpcclient.EventLoop;
import org.abstractica.rpcclient.TransportException;
import org.abstractica.rpcclient.TransportListener;
import org.abstractica.rpcclient.TransportSettings;
import org.abstractica.rpcclient.impl.protocol.RpcMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Client transport connected to a {@link LoopbackServer}.
 *
 * <p>Requests are served synchronously by the server; responses, send
 * completions and failures are delivered to the session as tasks on its
 * event loop, the way a socket transport would deliver them.</p>
 *
 * <p>Responses can be held back and released in any order, or the
 * connection failed on demand, to exercise timeouts, reordering and
 * failure handling.</p>
 */
public class LoopbackTransport implements ClientTransport
{
    private static final Logger LOG = LoggerFactory.getLogger(LoopbackTransport.class);

    private final LoopbackServer server;
    private final TransportListener listener;
    private final TransportSettings settings;
    private final EventLoop loop;
    private final AtomicBoolean open = new AtomicBoolean(true);

    // Responses held back, keyed by message id
    private final Map<Integer, RpcMessage.Response> held;
    private volatile boolean holdResponses = false;

    // Statistics
    private final AtomicInteger messagesSent = new AtomicInteger(0);
    private final AtomicInteger responsesDelivered = new AtomicInteger(0);

    LoopbackTransport(
            LoopbackServer server,
            TransportListener listener,
            TransportSettings settings,
            EventLoop loop
    )
    {
        this.server = Objects.requireNonNull(server, "server");
        this.listener = Objects.requireNonNull(listener, "listener");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.loop = Objects.requireNonNull(loop, "loop");
        this.held = new LinkedHashMap<>();
    }

    // ========== Configuration ==========

    /**
     * Sets whether responses are held back instead of delivered.
     *
     * @param hold true to hold responses until released
     */
    public void holdResponses(boolean hold)
    {
        this.holdResponses = hold;
    }

    /**
     * Delivers a held response.
     *
     * @param msgid the message id of the held response
     * @throws IllegalArgumentException if no response is held for the id
     */
    public void releaseResponse(int msgid)
    {
        RpcMessage.Response response;
        synchronized (held)
        {
            response = held.remove(msgid);
        }
        if (response == null)
        {
            throw new IllegalArgumentException("No held response for message id " + msgid);
        }
        deliver(response);
    }

    /**
     * Discards every held response, so the calls never get a reply.
     *
     * @return the number of discarded responses
     */
    public int dropHeldResponses()
    {
        synchronized (held)
        {
            int count = held.size();
            held.clear();
            return count;
        }
    }

    /**
     * Delivers an arbitrary response, whether or not it answers a request.
     *
     * @param msgid  the message id
     * @param error  the error, or null
     * @param result the result
     */
    public void injectResponse(int msgid, Object error, Object result)
    {
        deliver(new RpcMessage.Response(msgid, error, result));
    }

    /**
     * Reports a connection failure to the session.
     *
     * @param reason the failure description
     */
    public void failConnection(String reason)
    {
        TransportException failure = new TransportException(reason);
        loop.execute(() -> listener.onConnectFailed(failure));
    }

    // ========== ClientTransport Interface ==========

    @Override
    public void sendMessage(List<Object> message, Runnable onSent)
    {
        if (!open.get())
        {
            throw new IllegalStateException("Transport closed");
        }

        messagesSent.incrementAndGet();
        RpcMessage parsed = RpcMessage.fromArray(message);

        if (parsed instanceof RpcMessage.Request request)
        {
            RpcMessage.Response response = server.handle(request);
            if (holdResponses)
            {
                synchronized (held)
                {
                    held.put(response.msgid(), response);
                }
                LOG.debug("Holding response {}", response.msgid());
            }
            else
            {
                deliver(response);
            }
        }
        else if (parsed instanceof RpcMessage.Notify notify)
        {
            server.handle(notify);
        }
        else
        {
            throw new IllegalArgumentException("Clients cannot send " + parsed.getClass().getSimpleName());
        }

        if (onSent != null)
        {
            loop.execute(onSent);
        }
    }

    @Override
    public void close()
    {
        if (!open.compareAndSet(true, false))
        {
            return;
        }
        LOG.debug("Closing loopback transport");
        synchronized (held)
        {
            held.clear();
        }
    }

    // ========== Accessors ==========

    /**
     * Returns whether the transport is open.
     *
     * @return false after close
     */
    public boolean isOpen()
    {
        return open.get();
    }

    /**
     * Returns the settings the transport was built with.
     *
     * @return the settings
     */
    public TransportSettings getSettings()
    {
        return settings;
    }

    /**
     * Returns the number of held responses.
     *
     * @return responses waiting for release
     */
    public int heldCount()
    {
        synchronized (held)
        {
            return held.size();
        }
    }

    /**
     * Returns the number of messages sent through this transport.
     *
     * @return requests and notifications sent
     */
    public int getMessagesSent()
    {
        return messagesSent.get();
    }

    /**
     * Returns the number of responses handed to the session.
     *
     * @return responses delivered
     */
    public int getResponsesDelivered()
    {
        return responsesDelivered.get();
    }

    // ========== Internal ==========

    private void deliver(RpcMessage.Response response)
    {
        loop.execute(() ->
        {
            if (!open.get())
            {
                LOG.debug("Transport closed, dropping response {}", response.msgid());
                return;
            }
            responsesDelivered.incrementAndGet();
            listener.onResponse(response.msgid(), response.error(), response.result());
        });
    }
}
