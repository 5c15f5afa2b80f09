package org.abstractica.rpcclient.impl.session;

import org.abstractica.rpcclient.impl.protocol.RpcMessage;

/**
 * Generates message ids for outbound requests.
 *
 * <p>Ids run 0, 1, 2, ... up to and including {@link #MAX_ID}, then wrap to 0,
 * which keeps them small on the wire. Ids are unique among outstanding calls
 * as long as fewer than 2^30 + 1 calls are outstanding at once.</p>
 *
 * <p>Not thread-safe. Use from the session's loop only, or lock externally.</p>
 */
public class MessageIdGenerator
{
    /**
     * Largest id handed out before wrapping.
     */
    public static final int MAX_ID = RpcMessage.MAX_MSGID;

    private int counter;

    /**
     * Creates a generator starting at 0.
     */
    public MessageIdGenerator()
    {
        this(0);
    }

    /**
     * Creates a generator starting at the given id.
     *
     * @param first the first id to return
     */
    MessageIdGenerator(int first)
    {
        if (first < 0 || first > MAX_ID)
        {
            throw new IllegalArgumentException("first must be 0-" + MAX_ID + ": " + first);
        }
        this.counter = first;
    }

    /**
     * Returns the next id.
     *
     * @return an id in [0, 2^30]
     */
    public int next()
    {
        int id = counter;
        counter = (id == MAX_ID) ? 0 : id + 1;
        return id;
    }
}
