package org.abstractica.streamclient.impl.command;

import org.abstractica.streamclient.handlers.ResultHandler;

import java.util.Objects;

/**
 * A command awaiting its reply.
 *
 * @param correlationId the id carried by the command frame
 * @param command       the command name
 * @param issuedAtMs    time the command was issued
 * @param handler       receives the reply
 * @param transmittedOn connection attempt the frame was sent on, or null while buffered
 */
public record PendingCommand(
        long correlationId,
        String command,
        long issuedAtMs,
        ResultHandler handler,
        Long transmittedOn
)
{
    public PendingCommand
    {
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(handler, "handler");
    }

    /**
     * Returns a copy recording the connection attempt that carried the frame.
     *
     * @param attemptId the connection attempt
     * @return updated entry
     */
    public PendingCommand withTransmittedOn(long attemptId)
    {
        return new PendingCommand(correlationId, command, issuedAtMs, handler, attemptId);
    }
}
