package org.abstractica.streamclient.impl.events;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.abstractica.streamclient.Notification;
import org.abstractica.streamclient.handlers.NotificationListener;
import org.abstractica.streamclient.impl.protocol.InboundFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Republishes notification frames to the registered listeners.
 *
 * <p>In {@link Mode#PER_KIND} mode each notification goes to the listeners
 * registered for its name, carrying the payload unchanged. In
 * {@link Mode#AGGREGATED} mode every notification goes to the same listeners
 * and the payload carries a {@value #DISCRIMINATOR} field naming the kind.</p>
 *
 * <p>Listeners may be registered from any thread. Routing happens on the
 * client's event thread.</p>
 */
public class EventRouter
{
    private static final Logger LOG = LoggerFactory.getLogger(EventRouter.class);

    static final String DISCRIMINATOR = "notification";
    static final String WRAPPED_DATA = "data";

    /**
     * Delivery mode, fixed for the lifetime of the router.
     */
    public enum Mode
    {
        PER_KIND,
        AGGREGATED
    }

    private final Mode mode;
    private final Map<String, List<NotificationListener>> perKindListeners;
    private final List<NotificationListener> aggregatedListeners;

    public EventRouter(Mode mode)
    {
        this.mode = Objects.requireNonNull(mode, "mode");
        this.perKindListeners = new ConcurrentHashMap<>();
        this.aggregatedListeners = new CopyOnWriteArrayList<>();
    }

    public Mode getMode()
    {
        return mode;
    }

    // ========== Registration ==========

    /**
     * Registers a listener for one notification name.
     *
     * @param name     the notification name
     * @param listener the listener
     * @throws IllegalStateException if the router is in aggregated mode
     */
    public void addListener(String name, NotificationListener listener)
    {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(listener, "listener");
        if (name.isBlank())
        {
            throw new IllegalArgumentException("Notification name must not be empty");
        }
        if (mode != Mode.PER_KIND)
        {
            throw new IllegalStateException(
                    "Client delivers notifications on one aggregated channel, register without a kind");
        }
        perKindListeners.computeIfAbsent(name, k -> new CopyOnWriteArrayList<>()).add(listener);
    }

    /**
     * Registers a listener for all notifications.
     *
     * @param listener the listener
     * @throws IllegalStateException if the router is in per-kind mode
     */
    public void addListener(NotificationListener listener)
    {
        Objects.requireNonNull(listener, "listener");
        if (mode != Mode.AGGREGATED)
        {
            throw new IllegalStateException(
                    "Client delivers notifications per kind, enable globalListener to register for all");
        }
        aggregatedListeners.add(listener);
    }

    // ========== Routing ==========

    /**
     * Routes a notification frame.
     *
     * @param frame the notification frame
     * @return number of listeners the notification was delivered to
     */
    public int route(InboundFrame.NotificationFrame frame)
    {
        Objects.requireNonNull(frame, "frame");

        List<NotificationListener> listeners;
        Notification notification;
        if (mode == Mode.PER_KIND)
        {
            listeners = perKindListeners.getOrDefault(frame.name(), List.of());
            notification = new Notification(frame.name(), frame.payload());
        }
        else
        {
            listeners = aggregatedListeners;
            notification = new Notification(frame.name(), withDiscriminator(frame.name(), frame.payload()));
        }

        if (listeners.isEmpty())
        {
            LOG.debug("No listener for notification '{}'", frame.name());
            return 0;
        }

        for (NotificationListener listener : listeners)
        {
            safeCallback(listener, notification);
        }
        return listeners.size();
    }

    private static JsonNode withDiscriminator(String name, JsonNode payload)
    {
        if (payload.isObject())
        {
            ObjectNode copy = ((ObjectNode) payload).deepCopy();
            copy.put(DISCRIMINATOR, name);
            return copy;
        }
        ObjectNode wrapper = JsonNodeFactory.instance.objectNode();
        wrapper.put(DISCRIMINATOR, name);
        wrapper.set(WRAPPED_DATA, payload);
        return wrapper;
    }

    private static void safeCallback(NotificationListener listener, Notification notification)
    {
        try
        {
            listener.onNotification(notification);
        }
        catch (Exception e)
        {
            LOG.error("Notification listener failed for '{}'", notification.name(), e);
        }
    }
}
