package org.abstractica.streamclient;

import com.fasterxml.jackson.databind.JsonNode;
import org.abstractica.streamclient.handlers.ConnectionListener;
import org.abstractica.streamclient.handlers.NotificationListener;
import org.abstractica.streamclient.handlers.ResultHandler;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * A client holding one logical session with a streaming gateway.
 *
 * <p>The client keeps the session alive across physical reconnections,
 * correlates commands with their replies, and buffers outbound commands
 * until the session is ready. All operations return immediately; outcomes
 * are delivered asynchronously through the registered listeners, result
 * handlers and futures.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * StreamClient client = clientFactory.builder()
 *     .uri("ws://127.0.0.1:8001")
 *     .retryCount(5)
 *     .build();
 *
 * client.onConnectionEvent(event -> {
 *     if (event instanceof ConnectionEvent.Ready ready)
 *     {
 *         // Subscriptions can be issued here
 *     }
 * });
 *
 * client.onNotification(NotificationKind.TICKER, notification -> {
 *     // Handle ticker payload
 * });
 *
 * client.execute("subscribeToTickers", params);
 * }</pre>
 */
public interface StreamClient extends AutoCloseable
{
    /**
     * Starts connecting if the client is idle.
     *
     * <p>Not required in most cases: sending a command on an idle client
     * connects it lazily.</p>
     */
    void connect();

    /**
     * Drops the current connection and starts a fresh attempt immediately.
     *
     * <p>This is the only way out of {@link ConnectionState#TERMINATED}. The
     * attempt counter starts again from zero. Ignored while idle.</p>
     */
    void reconnect();

    /**
     * Disconnects and stops automatic reconnection.
     *
     * <p>Any scheduled retry is cancelled. The client connects again on the
     * next {@link #connect()} or command.</p>
     */
    void disconnect();

    /**
     * Disconnects and releases the client's resources.
     *
     * <p>The client cannot be used afterwards.</p>
     */
    @Override
    void close();

    /**
     * Sends a fire-and-forget command without parameters.
     *
     * @param command the command name
     */
    void execute(String command);

    /**
     * Sends a fire-and-forget command.
     *
     * <p>The command carries no correlation id and no reply is expected.</p>
     *
     * @param command the command name
     * @param params  the parameters, serialized to JSON (may be null)
     * @throws IllegalArgumentException if the command is blank or params cannot be serialized
     */
    void execute(String command, Object params);

    /**
     * Sends a command and delivers its reply to a handler.
     *
     * <p>The handler is invoked exactly once when a result or error frame
     * arrives, or, depending on the {@link PendingCommandPolicy}, when the
     * connection carrying the command is lost.</p>
     *
     * @param command the command name
     * @param params  the parameters, serialized to JSON (may be null)
     * @param handler the reply handler
     * @throws IllegalArgumentException if the command is blank or params cannot be serialized
     */
    void execute(String command, Object params, ResultHandler handler);

    /**
     * Sends a command and returns a future for its result.
     *
     * <p>The future completes with the result, or exceptionally with a
     * {@link CommandRejectedException} or {@link ConnectionResetException}.</p>
     *
     * @param command the command name
     * @param params  the parameters, serialized to JSON (may be null)
     * @return future completed with the command result
     * @throws IllegalArgumentException if the command is blank or params cannot be serialized
     */
    CompletableFuture<JsonNode> call(String command, Object params);

    /**
     * Registers a listener for connection lifecycle events.
     *
     * @param listener called for every connection event
     */
    void onConnectionEvent(ConnectionListener listener);

    /**
     * Registers a listener for one notification kind.
     *
     * @param kind     the notification kind
     * @param listener called with each notification of that kind
     * @throws IllegalStateException if the client delivers notifications in aggregated mode
     */
    void onNotification(NotificationKind kind, NotificationListener listener);

    /**
     * Registers a listener for a notification kind by its wire name.
     *
     * <p>Allows listening to kinds not enumerated by {@link NotificationKind}.</p>
     *
     * @param name     the notification name as sent by the gateway
     * @param listener called with each notification of that name
     * @throws IllegalStateException if the client delivers notifications in aggregated mode
     */
    void onNotification(String name, NotificationListener listener);

    /**
     * Registers a listener for all notifications.
     *
     * <p>Only available in aggregated mode. Each payload carries a
     * {@code notification} field naming its kind.</p>
     *
     * @param listener called with every notification
     * @throws IllegalStateException if the client delivers notifications per kind
     */
    void onNotification(NotificationListener listener);

    /**
     * Returns the session identifier, once known.
     *
     * @return the session id, or empty if none was configured or received yet
     */
    Optional<String> getSessionId();

    /**
     * Returns whether a transport connection is currently open.
     *
     * @return true if connected
     */
    boolean isConnected();

    /**
     * Returns whether the session has become ready at least once.
     *
     * @return true if ready
     */
    boolean isReady();

    /**
     * Returns the connection state.
     *
     * @return current state
     */
    ConnectionState getState();

    /**
     * Returns client statistics.
     *
     * @return current statistics snapshot
     */
    ClientStats getStats();
}
