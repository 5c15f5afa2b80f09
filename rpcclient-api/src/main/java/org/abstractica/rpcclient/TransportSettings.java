package org.abstractica.rpcclient;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * Options the session forwards to its transport without interpreting them.
 *
 * @param reconnectLimit maximum reconnection attempts before the connection is reported as failed
 * @param packEncoding   charset used to encode outbound strings
 * @param unpackEncoding charset used to decode inbound strings, or null to keep raw bytes
 */
public record TransportSettings(int reconnectLimit, Charset packEncoding, Charset unpackEncoding)
{
    /**
     * Default reconnection attempts.
     */
    public static final int DEFAULT_RECONNECT_LIMIT = 5;

    public TransportSettings
    {
        if (reconnectLimit < 0)
        {
            throw new IllegalArgumentException("reconnectLimit must be non-negative: " + reconnectLimit);
        }
        if (packEncoding == null)
        {
            packEncoding = StandardCharsets.UTF_8;
        }
    }

    /**
     * Returns the default settings.
     *
     * @return settings with 5 reconnect attempts, UTF-8 packing and raw unpacking
     */
    public static TransportSettings defaults()
    {
        return new TransportSettings(DEFAULT_RECONNECT_LIMIT, StandardCharsets.UTF_8, null);
    }
}
