package org.abstractica.rpcclient.impl.session;

import org.abstractica.rpcclient.ClientTransport;
import org.abstractica.rpcclient.EventLoop;
import org.abstractica.rpcclient.TransportBuilder;
import org.abstractica.rpcclient.TransportListener;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Transport test double recording every message sent.
 *
 * <p>Send completions are queued on the loop. An optional responder turns
 * each request into a response that is also queued on the loop.</p>
 */
class RecordingTransport implements ClientTransport
{
    private final List<List<Object>> sent = new ArrayList<>();
    private TransportListener listener;
    private EventLoop loop;
    private Function<List<?>, Object> responder;
    private RuntimeException sendFailure;
    private int closeCount;

    TransportBuilder builder()
    {
        return (listener, address, settings, loop) ->
        {
            this.listener = listener;
            this.loop = loop;
            return this;
        };
    }

    /**
     * Answers every request with the responder's result for its arguments.
     */
    void respondWith(Function<List<?>, Object> responder)
    {
        this.responder = responder;
    }

    void failSendsWith(RuntimeException failure)
    {
        this.sendFailure = failure;
    }

    @Override
    public void sendMessage(List<Object> message, Runnable onSent)
    {
        if (sendFailure != null)
        {
            throw sendFailure;
        }
        sent.add(message);

        if (responder != null && message.get(0).equals(0))
        {
            int msgid = (Integer) message.get(1);
            Object result = responder.apply((List<?>) message.get(3));
            loop.execute(() -> listener.onResponse(msgid, null, result));
        }
        if (onSent != null)
        {
            loop.execute(onSent);
        }
    }

    @Override
    public void close()
    {
        closeCount++;
    }

    List<List<Object>> sent()
    {
        return sent;
    }

    int msgidOf(int index)
    {
        return (Integer) sent.get(index).get(1);
    }

    int closeCount()
    {
        return closeCount;
    }
}
