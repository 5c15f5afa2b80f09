package org.abstractica.rpcclient.impl.protocol;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The three message shapes of the protocol.
 *
 * <p>Messages travel as position-significant arrays:</p>
 * <ul>
 *   <li>Request: {@code [0, msgid, method, args]}</li>
 *   <li>Response: {@code [1, msgid, error, result]}</li>
 *   <li>Notify: {@code [2, method, args]}</li>
 * </ul>
 *
 * <p>Encoding the arrays into bytes is the transport's job.</p>
 */
public sealed interface RpcMessage
{
    /**
     * Largest message id on the wire. Ids run from 0 to this value inclusive.
     */
    int MAX_MSGID = 1 << 30;

    /**
     * Returns the array form handed to the transport.
     *
     * @return an unmodifiable list of the message fields
     */
    List<Object> toArray();

    /**
     * A call expecting a response.
     *
     * @param msgid  the message id
     * @param method the method name
     * @param args   the arguments
     */
    record Request(int msgid, String method, List<Object> args) implements RpcMessage
    {
        public Request
        {
            Objects.requireNonNull(method, "method");
            Objects.requireNonNull(args, "args");
            if (msgid < 0)
            {
                throw new IllegalArgumentException("msgid must be non-negative: " + msgid);
            }
        }

        @Override
        public List<Object> toArray()
        {
            return fields(MessageType.REQUEST.getId(), msgid, method, args);
        }
    }

    /**
     * The server's answer to a request.
     *
     * @param msgid  the message id of the request
     * @param error  the error, or null on success
     * @param result the result
     */
    record Response(int msgid, Object error, Object result) implements RpcMessage
    {
        @Override
        public List<Object> toArray()
        {
            return fields(MessageType.RESPONSE.getId(), msgid, error, result);
        }
    }

    /**
     * A one-way call; the server sends nothing back.
     *
     * @param method the method name
     * @param args   the arguments
     */
    record Notify(String method, List<Object> args) implements RpcMessage
    {
        public Notify
        {
            Objects.requireNonNull(method, "method");
            Objects.requireNonNull(args, "args");
        }

        @Override
        public List<Object> toArray()
        {
            return fields(MessageType.NOTIFY.getId(), method, args);
        }
    }

    /**
     * Wraps call arguments as an unmodifiable list that may contain nulls.
     *
     * @param args the arguments, or null for none
     * @return the argument list
     */
    static List<Object> arguments(Object... args)
    {
        if (args == null || args.length == 0)
        {
            return Collections.emptyList();
        }
        return Collections.unmodifiableList(Arrays.asList(args.clone()));
    }

    /**
     * Parses a message from its array form.
     *
     * @param array the message fields
     * @return the parsed message
     * @throws IllegalArgumentException if the array is not a valid message
     */
    static RpcMessage fromArray(List<?> array)
    {
        Objects.requireNonNull(array, "array");
        if (array.isEmpty())
        {
            throw new IllegalArgumentException("Empty message");
        }

        MessageType type = MessageType.fromId(asInt(array.get(0), "type", 0, Integer.MAX_VALUE));
        expectSize(array, type == MessageType.NOTIFY ? 3 : 4, type);

        return switch (type)
        {
            case REQUEST -> new Request(asMsgid(array.get(1)), asString(array.get(2)), asArgs(array.get(3)));
            case RESPONSE -> new Response(asMsgid(array.get(1)), array.get(2), array.get(3));
            case NOTIFY -> new Notify(asString(array.get(1)), asArgs(array.get(2)));
        };
    }

    private static List<Object> fields(Object... values)
    {
        return Collections.unmodifiableList(Arrays.asList(values));
    }

    private static void expectSize(List<?> array, int size, MessageType type)
    {
        if (array.size() != size)
        {
            throw new IllegalArgumentException(
                    type + " must have " + size + " fields, got " + array.size());
        }
    }

    private static int asMsgid(Object value)
    {
        return asInt(value, "msgid", 0, MAX_MSGID);
    }

    private static int asInt(Object value, String field, int min, int max)
    {
        if (!(value instanceof Byte || value instanceof Short || value instanceof Integer || value instanceof Long))
        {
            throw new IllegalArgumentException("Field " + field + " is not an integer: " + value);
        }
        long number = ((Number) value).longValue();
        if (number < min || number > max)
        {
            throw new IllegalArgumentException("Field " + field + " out of range " + min + "-" + max + ": " + value);
        }
        return (int) number;
    }

    private static String asString(Object value)
    {
        if (!(value instanceof String))
        {
            throw new IllegalArgumentException("Method name is not a string: " + value);
        }
        return (String) value;
    }

    private static List<Object> asArgs(Object value)
    {
        if (!(value instanceof List))
        {
            throw new IllegalArgumentException("Arguments are not a sequence: " + value);
        }
        return Collections.unmodifiableList(Arrays.asList(((List<?>) value).toArray()));
    }
}
