package org.abstractica.streamclient.impl.client;

import org.abstractica.streamclient.transport.Transport;

import java.util.Objects;

/**
 * One physical connection attempt.
 *
 * @param attemptId   strictly increasing id, never reused
 * @param transport   the attempt's transport
 * @param startedAtMs time the attempt started
 */
record ConnectionAttempt(long attemptId, Transport transport, long startedAtMs)
{
    ConnectionAttempt
    {
        Objects.requireNonNull(transport, "transport");
    }
}
