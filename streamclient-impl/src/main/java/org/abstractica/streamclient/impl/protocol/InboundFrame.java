package org.abstractica.streamclient.impl.protocol;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * A decoded frame received from the gateway.
 *
 * <p>Wire shapes:</p>
 * <pre>
 * { "hello": { "sid": sessionId, "isNew": bool } }
 * { "i": correlationId, "r": result }
 * { "i": correlationId, "e": error }
 * { "n": kind, "d": payload }
 * </pre>
 */
public sealed interface InboundFrame
{
    /**
     * Session handshake, always the first frame on a connection.
     *
     * @param sessionId the session identifier
     * @param isNew     true if the gateway could not resume the requested session
     */
    record Hello(String sessionId, boolean isNew) implements InboundFrame
    {
        public Hello
        {
            Objects.requireNonNull(sessionId, "sessionId");
        }
    }

    /**
     * Successful reply to a correlated command.
     *
     * @param correlationId the command's correlation id
     * @param result        the result, possibly a JSON null
     */
    record Result(long correlationId, JsonNode result) implements InboundFrame
    {
        public Result
        {
            Objects.requireNonNull(result, "result");
        }
    }

    /**
     * Error reply to a correlated command.
     *
     * @param correlationId the command's correlation id
     * @param error         the error object
     */
    record ErrorReply(long correlationId, JsonNode error) implements InboundFrame
    {
        public ErrorReply
        {
            Objects.requireNonNull(error, "error");
        }
    }

    /**
     * Unsolicited notification.
     *
     * @param name    the notification kind as sent on the wire
     * @param payload the notification data
     */
    record NotificationFrame(String name, JsonNode payload) implements InboundFrame
    {
        public NotificationFrame
        {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(payload, "payload");
        }
    }
}
