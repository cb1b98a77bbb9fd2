package org.abstractica.streamclient;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;
import java.util.Optional;

/**
 * A notification pushed by the gateway.
 *
 * @param name    the notification name as sent on the wire
 * @param payload the notification payload
 */
public record Notification(String name, JsonNode payload)
{
    public Notification
    {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(payload, "payload");
    }

    /**
     * Returns the notification kind, if it is a known one.
     *
     * @return the kind, or empty for names not covered by {@link NotificationKind}
     */
    public Optional<NotificationKind> kind()
    {
        return NotificationKind.fromWireName(name);
    }
}
