package org.abstractica.streamclient;

/**
 * State of the client's logical connection.
 */
public enum ConnectionState
{
    /**
     * No connection and no attempt scheduled.
     */
    IDLE,

    /**
     * A connection attempt is in flight.
     */
    CONNECTING,

    /**
     * The transport is connected. The session may not be ready yet.
     */
    OPEN,

    /**
     * Waiting for the retry delay before the next attempt.
     */
    BACKOFF,

    /**
     * Retries are exhausted. Only {@link StreamClient#reconnect()} resumes.
     */
    TERMINATED
}
