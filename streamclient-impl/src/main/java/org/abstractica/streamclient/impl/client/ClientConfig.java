package org.abstractica.streamclient.impl.client;

import org.abstractica.streamclient.PendingCommandPolicy;
import org.abstractica.streamclient.impl.session.ConnectionAddress;
import org.abstractica.streamclient.transport.TransportFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Validated, immutable client configuration.
 *
 * @param address              gateway address
 * @param autoConnect          connect as soon as the client is built
 * @param globalListener       deliver notifications on one aggregated channel
 * @param sessionId            session to resume, or null
 * @param apiKey               API key sent with each connection, or null
 * @param retryCount           retries after consecutive failed attempts, or {@link #UNBOUNDED_RETRIES}
 * @param retryDelay           delay before each reconnection attempt
 * @param pingTimeout          silence tolerated on an open connection
 * @param pendingCommandPolicy fate of unanswered commands on a lost connection
 * @param transportFactory     creates one transport per attempt
 */
public record ClientConfig(
        ConnectionAddress address,
        boolean autoConnect,
        boolean globalListener,
        String sessionId,
        String apiKey,
        int retryCount,
        Duration retryDelay,
        Duration pingTimeout,
        PendingCommandPolicy pendingCommandPolicy,
        TransportFactory transportFactory
)
{
    public static final int UNBOUNDED_RETRIES = -1;
    public static final Duration MIN_RETRY_DELAY = Duration.ofMillis(1000);
    public static final Duration DEFAULT_RETRY_DELAY = Duration.ofMillis(10000);
    public static final Duration MIN_PING_TIMEOUT = Duration.ofMillis(1000);
    public static final Duration DEFAULT_PING_TIMEOUT = Duration.ofMillis(30000);

    /**
     * Handshake header carrying the API key.
     */
    public static final String API_KEY_HEADER = "ApiKey";

    public ClientConfig
    {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(retryDelay, "retryDelay");
        Objects.requireNonNull(pingTimeout, "pingTimeout");
        Objects.requireNonNull(pendingCommandPolicy, "pendingCommandPolicy");
        Objects.requireNonNull(transportFactory, "transportFactory");
        checkRetryCount(retryCount);
        checkRetryDelay(retryDelay);
        checkPingTimeout(pingTimeout);
    }

    public boolean isRetryUnbounded()
    {
        return retryCount == UNBOUNDED_RETRIES;
    }

    /**
     * Returns the headers sent when opening a connection.
     *
     * @return handshake headers
     */
    public Map<String, String> handshakeHeaders()
    {
        return apiKey == null ? Map.of() : Map.of(API_KEY_HEADER, apiKey);
    }

    // ========== Validation ==========

    static void checkRetryCount(int retryCount)
    {
        if (retryCount < 0 && retryCount != UNBOUNDED_RETRIES)
        {
            throw new IllegalArgumentException("Retry count must be >= 0: " + retryCount);
        }
    }

    static void checkRetryDelay(Duration retryDelay)
    {
        if (retryDelay.compareTo(MIN_RETRY_DELAY) < 0)
        {
            throw new IllegalArgumentException("Retry delay must be at least 1000 ms: " + retryDelay.toMillis());
        }
    }

    static void checkPingTimeout(Duration pingTimeout)
    {
        if (pingTimeout.compareTo(MIN_PING_TIMEOUT) < 0)
        {
            throw new IllegalArgumentException("Ping timeout must be at least 1000 ms: " + pingTimeout.toMillis());
        }
    }
}
