package org.abstractica.rpcclient.impl.transport;

import org.abstractica.rpcclient.ClientTransport;
import org.abstractica.rpcclient.TransportException;
import org.abstractica.rpcclient.TransportListener;
import org.abstractica.rpcclient.TransportSettings;
import org.abstractica.rpcclient.impl.loop.DefaultEventLoop;
import org.abstractica.rpcclient.impl.protocol.RpcMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link LoopbackTransport} and {@link LoopbackServer}.
 */
class LoopbackTransportTest
{
    private final List<String> received = new ArrayList<>();

    private DefaultEventLoop loop;
    private LoopbackServer server;
    private LoopbackTransport transport;

    @BeforeEach
    void setUp()
    {
        loop = new DefaultEventLoop();
        server = new LoopbackServer()
                .register("echo", args -> args.get(0))
                .register("fail", args ->
                {
                    throw new IllegalArgumentException("bad input");
                });

        TransportListener listener = new TransportListener()
        {
            @Override
            public void onResponse(int msgid, Object error, Object result)
            {
                received.add(msgid + ":" + error + ":" + result);
            }

            @Override
            public void onConnectFailed(TransportException reason)
            {
                received.add("failed:" + reason.getMessage());
            }
        };

        ClientTransport built = server.transportBuilder().build(
                listener, InetSocketAddress.createUnresolved("localhost", 18800), TransportSettings.defaults(), loop);
        transport = (LoopbackTransport) built;
    }

    @Test
    void request_responseDeliveredOnLoop()
    {
        transport.sendMessage(request(0, "echo", "hi"), null);

        // Nothing is delivered until the loop runs
        assertTrue(received.isEmpty());
        runLoop();

        assertEquals(List.of("0:null:hi"), received);
        assertEquals(1, transport.getResponsesDelivered());
    }

    @Test
    void request_handlerExceptionBecomesError()
    {
        transport.sendMessage(request(4, "fail"), null);
        runLoop();

        assertEquals(List.of("4:bad input:null"), received);
    }

    @Test
    void request_unknownMethodBecomesError()
    {
        transport.sendMessage(request(1, "missing"), null);
        runLoop();

        assertEquals(List.of("1:Method not found: missing:null"), received);
    }

    @Test
    void heldResponses_releasedInAnyOrder()
    {
        transport.holdResponses(true);
        transport.sendMessage(request(0, "echo", "a"), null);
        transport.sendMessage(request(1, "echo", "b"), null);
        assertEquals(2, transport.heldCount());

        transport.releaseResponse(1);
        transport.releaseResponse(0);
        runLoop();

        assertEquals(List.of("1:null:b", "0:null:a"), received);
        assertThrows(IllegalArgumentException.class, () -> transport.releaseResponse(0));
    }

    @Test
    void dropHeldResponses_discardsThem()
    {
        transport.holdResponses(true);
        transport.sendMessage(request(0, "echo", "a"), null);

        assertEquals(1, transport.dropHeldResponses());
        runLoop();

        assertTrue(received.isEmpty());
    }

    @Test
    void notify_reachesServerAndCompletesSend()
    {
        List<Boolean> sent = new ArrayList<>();
        transport.sendMessage(new RpcMessage.Notify("log", RpcMessage.arguments("x")).toArray(), () -> sent.add(true));
        runLoop();

        assertEquals(List.of(true), sent);
        assertEquals(List.of(new RpcMessage.Notify("log", List.of("x"))), server.getNotifications());
        assertTrue(received.isEmpty());
    }

    @Test
    void failConnection_reportedOnLoop()
    {
        transport.failConnection("Connection refused");
        runLoop();

        assertEquals(List.of("failed:Connection refused"), received);
    }

    @Test
    void close_dropsUndeliveredResponsesAndRejectsSends()
    {
        transport.sendMessage(request(0, "echo", "a"), null);
        transport.close();
        runLoop();

        assertTrue(received.isEmpty());
        assertFalse(transport.isOpen());
        assertThrows(IllegalStateException.class, () -> transport.sendMessage(request(1, "echo", "b"), null));
    }

    @Test
    void server_tracksLastTransport()
    {
        assertSame(transport, server.lastTransport());
        assertThrows(IllegalStateException.class, () -> new LoopbackServer().lastTransport());
    }

    private static List<Object> request(int msgid, String method, Object... args)
    {
        return new RpcMessage.Request(msgid, method, RpcMessage.arguments(args)).toArray();
    }

    private void runLoop()
    {
        loop.execute(loop::stop);
        loop.start();
    }
}
