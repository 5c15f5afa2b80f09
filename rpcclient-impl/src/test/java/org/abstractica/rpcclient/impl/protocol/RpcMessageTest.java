package org.abstractica.rpcclient.impl.protocol;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link RpcMessage}.
 */
class RpcMessageTest
{
    @Test
    void request_arrayFormIsPositional()
    {
        RpcMessage.Request request = new RpcMessage.Request(7, "add", RpcMessage.arguments(2, 3));

        assertEquals(List.of(0, 7, "add", List.of(2, 3)), request.toArray());
    }

    @Test
    void notify_arrayFormHasNoId()
    {
        RpcMessage.Notify notify = new RpcMessage.Notify("log", RpcMessage.arguments("hello"));

        assertEquals(List.of(2, "log", List.of("hello")), notify.toArray());
    }

    @Test
    void response_arrayFormKeepsNullError()
    {
        List<Object> array = new RpcMessage.Response(3, null, "ok").toArray();

        assertEquals(Arrays.asList(1, 3, null, "ok"), array);
    }

    @Test
    void arguments_copiesArrayAndKeepsNulls()
    {
        Object[] args = {"a", null};
        List<Object> list = RpcMessage.arguments(args);
        args[0] = "changed";

        assertEquals(Arrays.asList("a", null), list);
        assertThrows(UnsupportedOperationException.class, () -> list.add("b"));
    }

    @Test
    void arguments_noneGivesEmptyList()
    {
        assertTrue(RpcMessage.arguments().isEmpty());
        assertTrue(RpcMessage.arguments((Object[]) null).isEmpty());
    }

    @Test
    void fromArray_parsesEachShape()
    {
        RpcMessage request = RpcMessage.fromArray(List.of(0, 1, "echo", List.of("x")));
        RpcMessage response = RpcMessage.fromArray(Arrays.asList(1, 1, null, "x"));
        RpcMessage notify = RpcMessage.fromArray(List.of(2, "log", List.of()));

        assertEquals(new RpcMessage.Request(1, "echo", List.of("x")), request);
        assertEquals(new RpcMessage.Response(1, null, "x"), response);
        assertEquals(new RpcMessage.Notify("log", List.of()), notify);
    }

    @Test
    void fromArray_rejectsMalformedMessages()
    {
        assertThrows(IllegalArgumentException.class, () -> RpcMessage.fromArray(List.of()));
        assertThrows(IllegalArgumentException.class, () -> RpcMessage.fromArray(List.of(9, 1, "x", List.of())));
        assertThrows(IllegalArgumentException.class, () -> RpcMessage.fromArray(List.of(0, 1, "x")));
        assertThrows(IllegalArgumentException.class, () -> RpcMessage.fromArray(List.of(0, "id", "x", List.of())));
        assertThrows(IllegalArgumentException.class, () -> RpcMessage.fromArray(List.of(2, 5, List.of())));
        assertThrows(IllegalArgumentException.class, () -> RpcMessage.fromArray(List.of(2, "log", "not-a-list")));
    }

    @Test
    void fromArray_rejectsIdsOutsideWireRange()
    {
        long aliasOfZero = 1L << 32;

        assertThrows(IllegalArgumentException.class,
                () -> RpcMessage.fromArray(Arrays.asList(1, aliasOfZero, null, "x")));
        assertThrows(IllegalArgumentException.class,
                () -> RpcMessage.fromArray(Arrays.asList(1, RpcMessage.MAX_MSGID + 1, null, "x")));
        assertThrows(IllegalArgumentException.class,
                () -> RpcMessage.fromArray(Arrays.asList(1, -1, null, "x")));
        assertThrows(IllegalArgumentException.class,
                () -> RpcMessage.fromArray(Arrays.asList(1, 1.5, null, "x")));

        RpcMessage.Response response = (RpcMessage.Response) RpcMessage.fromArray(
                Arrays.asList(1, (long) RpcMessage.MAX_MSGID, null, "x"));
        assertEquals(RpcMessage.MAX_MSGID, response.msgid());
    }

    @Test
    void request_rejectsNegativeId()
    {
        assertThrows(IllegalArgumentException.class, () -> new RpcMessage.Request(-1, "x", List.of()));
    }

    @Test
    void messageType_lookupByTag()
    {
        assertEquals(MessageType.REQUEST, MessageType.fromId(0));
        assertEquals(MessageType.RESPONSE, MessageType.fromId(1));
        assertEquals(MessageType.NOTIFY, MessageType.fromId(2));
        assertThrows(IllegalArgumentException.class, () -> MessageType.fromId(3));
    }
}
