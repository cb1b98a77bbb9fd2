package org.abstractica.streamclient;

import java.util.Objects;

/**
 * Observable change in the client's connection or session.
 *
 * <p>Sealed interface enabling exhaustive handling of lifecycle events.
 * Attempt ids increase with every connection attempt and are never reused.</p>
 */
public sealed interface ConnectionEvent
{
    /**
     * Transport connected. The session is not ready until {@link Ready}.
     *
     * @param attemptId the connection attempt
     */
    record Connected(long attemptId) implements ConnectionEvent {}

    /**
     * Session is ready for commands.
     *
     * <p>Raised the first time a handshake arrives and again whenever the
     * gateway reports a new session.</p>
     *
     * @param sessionId the session identifier
     * @param isNew     true if the gateway created a new session
     */
    record Ready(String sessionId, boolean isNew) implements ConnectionEvent
    {
        public Ready
        {
            Objects.requireNonNull(sessionId, "sessionId");
        }
    }

    /**
     * Connection was lost. Reconnection is automatic.
     *
     * @param attemptId the connection attempt that was lost
     * @param code      close code
     * @param reason    close reason
     */
    record Disconnected(long attemptId, int code, String reason) implements ConnectionEvent
    {
        public Disconnected
        {
            Objects.requireNonNull(reason, "reason");
        }
    }

    /**
     * Connection attempt failed. Another attempt is scheduled.
     *
     * @param attemptId the failed connection attempt
     * @param attempts  consecutive failed attempts so far
     * @param error     the failure
     */
    record ConnectionError(long attemptId, int attempts, Throwable error) implements ConnectionEvent
    {
        public ConnectionError
        {
            Objects.requireNonNull(error, "error");
        }
    }

    /**
     * Connection attempt failed and no retry is left.
     *
     * <p>Final until {@link StreamClient#reconnect()} is called.</p>
     *
     * @param attemptId the failed connection attempt
     * @param attempts  consecutive failed attempts
     * @param error     the failure
     */
    record Terminated(long attemptId, int attempts, Throwable error) implements ConnectionEvent
    {
        public Terminated
        {
            Objects.requireNonNull(error, "error");
        }
    }
}
