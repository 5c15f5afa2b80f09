package org.abstractica.rpcclient.impl.protocol;

/**
 * Message type tags as defined in the wire protocol.
 *
 * <p>The tag is the first element of every message array.</p>
 */
public enum MessageType
{
    REQUEST(0),
    RESPONSE(1),
    NOTIFY(2);

    private final int id;

    MessageType(int id)
    {
        this.id = id;
    }

    /**
     * Returns the wire protocol tag for this message type.
     *
     * @return the tag value
     */
    public int getId()
    {
        return id;
    }

    /**
     * Looks up a message type by its wire protocol tag.
     *
     * @param id the tag value
     * @return the message type
     * @throws IllegalArgumentException if the tag is unknown
     */
    public static MessageType fromId(int id)
    {
        for (MessageType type : values())
        {
            if (type.id == id)
            {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown message type: " + id);
    }
}
