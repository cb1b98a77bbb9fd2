package org.abstractica.streamclient;

/**
 * Client statistics for monitoring and observability.
 *
 * <p>Statistics are pollable snapshots. The application can query these
 * values and push to a monitoring system of choice.</p>
 */
public interface ClientStats
{
    /**
     * Returns the number of frames handed to a transport.
     *
     * @return frames sent
     */
    long getFramesSent();

    /**
     * Returns the number of frames received from a transport.
     *
     * @return frames received
     */
    long getFramesReceived();

    /**
     * Returns the number of inbound frames dropped as malformed or premature.
     *
     * @return frames dropped
     */
    long getFramesDropped();

    /**
     * Returns the number of connection attempts started.
     *
     * @return connection attempts
     */
    long getConnectionAttempts();

    /**
     * Returns the number of frames waiting for the session to become ready.
     *
     * @return queued frames
     */
    int getQueuedFrames();

    /**
     * Returns the number of commands awaiting a reply.
     *
     * @return pending commands
     */
    int getPendingCommands();
}
