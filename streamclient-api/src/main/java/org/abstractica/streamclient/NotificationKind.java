package org.abstractica.streamclient;

import java.util.Objects;
import java.util.Optional;

/**
 * Notification kinds pushed by the gateway.
 */
public enum NotificationKind
{
    TICKER("ticker"),
    ORDER_BOOK("orderBook"),
    ORDER_BOOK_UPDATE("orderBookUpdate"),
    TRADES("trades"),
    KLINE("kline"),
    TICKER_MONITOR("tickerMonitor");

    private final String wireName;

    NotificationKind(String wireName)
    {
        this.wireName = wireName;
    }

    /**
     * Returns the name used on the wire.
     *
     * @return wire name
     */
    public String getWireName()
    {
        return wireName;
    }

    /**
     * Looks up a kind by its wire name.
     *
     * @param wireName the name used on the wire
     * @return the kind, or empty if unknown
     */
    public static Optional<NotificationKind> fromWireName(String wireName)
    {
        Objects.requireNonNull(wireName, "wireName");
        for (NotificationKind kind : values())
        {
            if (kind.wireName.equals(wireName))
            {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
