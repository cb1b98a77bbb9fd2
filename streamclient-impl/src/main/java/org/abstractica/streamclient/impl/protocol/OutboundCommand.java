package org.abstractica.streamclient.impl.protocol;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * A command sent to the gateway.
 *
 * <p>Wire format:</p>
 * <pre>
 * { "m": method, "p": params (optional), "i": correlationId (optional) }
 * </pre>
 *
 * @param method        the command name
 * @param params        command parameters, or null
 * @param correlationId correlation id, or null for fire-and-forget commands
 */
public record OutboundCommand(
        String method,
        JsonNode params,
        Long correlationId
)
{
    public OutboundCommand
    {
        Objects.requireNonNull(method, "method");
        if (method.isBlank())
        {
            throw new IllegalArgumentException("Command name must not be empty");
        }
    }

    /**
     * Creates a command that expects no reply.
     *
     * @param method the command name
     * @param params the parameters, or null
     * @return the command
     */
    public static OutboundCommand fireAndForget(String method, JsonNode params)
    {
        return new OutboundCommand(method, params, null);
    }

    /**
     * Creates a command carrying a correlation id.
     *
     * @param method        the command name
     * @param params        the parameters, or null
     * @param correlationId the correlation id
     * @return the command
     */
    public static OutboundCommand correlated(String method, JsonNode params, long correlationId)
    {
        return new OutboundCommand(method, params, correlationId);
    }

    public boolean expectsReply()
    {
        return correlationId != null;
    }
}
