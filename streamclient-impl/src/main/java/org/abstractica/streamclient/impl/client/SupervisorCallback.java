package org.abstractica.streamclient.impl.client;

import org.abstractica.streamclient.ConnectionEvent;
import org.abstractica.streamclient.transport.TransportRequest;

/**
 * Callback interface from the connection supervisor to the client.
 *
 * <p>All methods are called on the client's event thread.</p>
 */
public interface SupervisorCallback
{
    /**
     * Builds the request for the next connection attempt.
     *
     * @return the transport request
     */
    TransportRequest nextRequest();

    /**
     * Notifies that a frame arrived on the open connection.
     *
     * @param attemptId the connection attempt
     * @param frame     the raw frame
     */
    void onFrame(long attemptId, String frame);

    /**
     * Notifies that an open connection is gone, whatever the cause.
     *
     * @param attemptId the lost connection attempt
     */
    void onConnectionLost(long attemptId);

    /**
     * Publishes a connection event to the application.
     *
     * @param event the event
     */
    void onConnectionEvent(ConnectionEvent event);
}
