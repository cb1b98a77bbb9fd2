package org.abstractica.streamclient.handlers;

import org.abstractica.streamclient.ConnectionEvent;

/**
 * Receives connection lifecycle events.
 *
 * <p>Listeners are called from the client's event thread and must not
 * block. Exceptions thrown by a listener are logged and do not affect the
 * connection.</p>
 */
@FunctionalInterface
public interface ConnectionListener
{
    /**
     * Handles a connection event.
     *
     * @param event the event
     */
    void onEvent(ConnectionEvent event);
}
