package org.abstractica.streamclient.handlers;

import org.abstractica.streamclient.Notification;

/**
 * Receives notifications pushed by the gateway.
 *
 * <p>Listeners are called from the client's event thread; if the work is
 * heavy, the listener should hand the notification off elsewhere.</p>
 */
@FunctionalInterface
public interface NotificationListener
{
    /**
     * Handles a notification.
     *
     * @param notification the notification
     */
    void onNotification(Notification notification);
}
