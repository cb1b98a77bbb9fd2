package org.abstractica.streamclient.impl.outbound;

import org.abstractica.streamclient.impl.protocol.OutboundCommand;

import java.util.Objects;

/**
 * A command frame waiting for the session to become ready.
 *
 * @param command      the command, kept for correlation bookkeeping on send
 * @param frame        the encoded frame
 * @param enqueuedAtMs time the frame was buffered
 */
public record QueuedMessage(OutboundCommand command, String frame, long enqueuedAtMs)
{
    public QueuedMessage
    {
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(frame, "frame");
    }
}
