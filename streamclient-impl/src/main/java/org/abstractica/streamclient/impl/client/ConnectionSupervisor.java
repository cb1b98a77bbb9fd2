package org.abstractica.streamclient.impl.client;

import org.abstractica.streamclient.ConnectionEvent;
import org.abstractica.streamclient.ConnectionState;
import org.abstractica.streamclient.transport.Transport;
import org.abstractica.streamclient.transport.TransportFactory;
import org.abstractica.streamclient.transport.TransportListener;
import org.abstractica.streamclient.transport.TransportRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;

/**
 * Owns the client's single physical connection and keeps it alive.
 *
 * <p>State machine:</p>
 * <pre>
 * IDLE --connect--&gt; CONNECTING --connected--&gt; OPEN
 * CONNECTING --failed, retry left--&gt; BACKOFF --delay--&gt; CONNECTING
 * CONNECTING --failed, no retry left--&gt; TERMINATED --reconnect--&gt; CONNECTING
 * OPEN --closed / error / ping timeout--&gt; BACKOFF
 * any --disconnect--&gt; IDLE
 * </pre>
 *
 * <p>Failed attempts are counted per logical connection. The count starts
 * again after an open connection is lost and after an explicit reconnect.</p>
 *
 * <p>All methods must be called on the client's event thread. Transport
 * signals are marshalled onto it, and signals from a transport that is no
 * longer current are ignored.</p>
 */
public class ConnectionSupervisor
{
    private static final Logger LOG = LoggerFactory.getLogger(ConnectionSupervisor.class);

    /**
     * Close code reported when a connection dies without a close frame.
     */
    public static final int ABNORMAL_CLOSURE = 1006;
    public static final String PING_TIMEOUT_REASON = "ping timeout";

    private final TransportFactory transportFactory;
    private final Scheduler scheduler;
    private final SupervisorCallback callback;
    private final DefaultClientStats stats;
    private final int retryCount;
    private final Duration retryDelay;
    private final Duration pingTimeout;

    private volatile ConnectionState state;
    private ConnectionAttempt current;
    private long lastAttemptId;
    private int failedAttempts;
    private long lastActivityMs;
    private Scheduler.ScheduledTask retryTask;
    private Scheduler.ScheduledTask keepaliveTask;

    public ConnectionSupervisor(
            ClientConfig config,
            Scheduler scheduler,
            SupervisorCallback callback,
            DefaultClientStats stats
    )
    {
        Objects.requireNonNull(config, "config");
        this.transportFactory = config.transportFactory();
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.callback = Objects.requireNonNull(callback, "callback");
        this.stats = Objects.requireNonNull(stats, "stats");
        this.retryCount = config.retryCount();
        this.retryDelay = config.retryDelay();
        this.pingTimeout = config.pingTimeout();
        this.state = ConnectionState.IDLE;
    }

    // ========== Commands ==========

    /**
     * Starts connecting if idle.
     */
    public void connect()
    {
        if (state != ConnectionState.IDLE)
        {
            return;
        }
        failedAttempts = 0;
        startAttempt();
    }

    /**
     * Replaces the current connection with a fresh attempt.
     *
     * <p>Ignored while idle. Leaves {@link ConnectionState#TERMINATED}.</p>
     */
    public void reconnect()
    {
        if (state == ConnectionState.IDLE)
        {
            return;
        }
        LOG.info("Reconnecting (state was {})", state);
        cancelRetry();
        dropCurrent();
        failedAttempts = 0;
        startAttempt();
    }

    /**
     * Drops the connection and stops reconnecting.
     */
    public void disconnect()
    {
        if (state == ConnectionState.IDLE)
        {
            return;
        }
        LOG.info("Disconnecting (state was {})", state);
        cancelRetry();
        dropCurrent();
        state = ConnectionState.IDLE;
    }

    /**
     * Sends a frame on the open connection.
     *
     * @param frame the frame
     * @return the attempt id of the connection that carried it
     * @throws IllegalStateException if no connection is open
     */
    public long send(String frame)
    {
        if (state != ConnectionState.OPEN || current == null)
        {
            throw new IllegalStateException("No open connection, state is " + state);
        }
        current.transport().send(frame);
        stats.recordFrameSent();
        return current.attemptId();
    }

    // ========== Queries ==========

    public ConnectionState getState()
    {
        return state;
    }

    public boolean isOpen()
    {
        return state == ConnectionState.OPEN;
    }

    /**
     * Returns the number of consecutive failed attempts of the current logical connection.
     *
     * @return failed attempts
     */
    public int getFailedAttempts()
    {
        return failedAttempts;
    }

    public long getLastAttemptId()
    {
        return lastAttemptId;
    }

    // ========== Attempt Lifecycle ==========

    private void startAttempt()
    {
        long attemptId = ++lastAttemptId;
        state = ConnectionState.CONNECTING;
        stats.recordConnectionAttempt();

        Transport transport;
        try
        {
            TransportRequest request = callback.nextRequest();
            LOG.info("Connection #{} connecting to {}", attemptId, request.uri());
            transport = transportFactory.create(request, new AttemptListener(attemptId));
        }
        catch (RuntimeException e)
        {
            LOG.warn("Connection #{} could not be created", attemptId, e);
            onAttemptFailed(attemptId, e, !(e instanceof IllegalArgumentException));
            return;
        }

        current = new ConnectionAttempt(attemptId, transport, scheduler.nowMillis());
        transport.connect();
    }

    private void onTransportConnected(long attemptId)
    {
        if (!isCurrent(attemptId) || state != ConnectionState.CONNECTING)
        {
            return;
        }
        LOG.info("Connection #{} connected", attemptId);
        state = ConnectionState.OPEN;
        lastActivityMs = scheduler.nowMillis();
        armKeepalive(attemptId);
        callback.onConnectionEvent(new ConnectionEvent.Connected(attemptId));
    }

    private void onTransportMessage(long attemptId, String frame)
    {
        if (!isCurrent(attemptId) || state != ConnectionState.OPEN)
        {
            return;
        }
        lastActivityMs = scheduler.nowMillis();
        callback.onFrame(attemptId, frame);
    }

    private void onTransportPong(long attemptId)
    {
        if (isCurrent(attemptId))
        {
            lastActivityMs = scheduler.nowMillis();
        }
    }

    private void onTransportClosed(long attemptId, int code, String reason)
    {
        if (!isCurrent(attemptId))
        {
            return;
        }
        if (state == ConnectionState.CONNECTING)
        {
            onAttemptFailed(attemptId,
                    new IOException("Connection closed during handshake: " + code + " " + reason), true);
        }
        else if (state == ConnectionState.OPEN)
        {
            onConnectionLost(code, reason);
        }
    }

    private void onTransportError(long attemptId, Throwable error, boolean retryable)
    {
        if (!isCurrent(attemptId))
        {
            return;
        }
        if (state == ConnectionState.CONNECTING)
        {
            onAttemptFailed(attemptId, error, retryable);
        }
        else if (state == ConnectionState.OPEN)
        {
            String reason = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
            onConnectionLost(ABNORMAL_CLOSURE, reason);
        }
    }

    private void onAttemptFailed(long attemptId, Throwable error, boolean retryable)
    {
        closeCurrentTransport();
        failedAttempts++;

        boolean retryLeft = retryCount == ClientConfig.UNBOUNDED_RETRIES || failedAttempts <= retryCount;
        if (retryable && retryLeft)
        {
            LOG.warn("Connection #{} failed (will retry in {}ms): attempts = {}, error = {}",
                    attemptId, retryDelay.toMillis(), failedAttempts, error.toString());
            state = ConnectionState.BACKOFF;
            scheduleRetry();
            callback.onConnectionEvent(new ConnectionEvent.ConnectionError(attemptId, failedAttempts, error));
        }
        else
        {
            LOG.warn("Connection #{} failed (no retry left): attempts = {}, error = {}",
                    attemptId, failedAttempts, error.toString());
            state = ConnectionState.TERMINATED;
            callback.onConnectionEvent(new ConnectionEvent.Terminated(attemptId, failedAttempts, error));
        }
    }

    private void onConnectionLost(int code, String reason)
    {
        long attemptId = current.attemptId();
        LOG.info("Connection #{} disconnected (will reconnect in {}ms): code = {}, reason = '{}'",
                attemptId, retryDelay.toMillis(), code, reason);

        closeCurrentTransport();
        failedAttempts = 0;
        state = ConnectionState.BACKOFF;
        scheduleRetry();
        callback.onConnectionEvent(new ConnectionEvent.Disconnected(attemptId, code, reason));
        callback.onConnectionLost(attemptId);
    }

    // ========== Retry ==========

    private void scheduleRetry()
    {
        cancelRetry();
        retryTask = scheduler.schedule(this::onRetryDelayElapsed, retryDelay);
    }

    private void onRetryDelayElapsed()
    {
        retryTask = null;
        if (state != ConnectionState.BACKOFF)
        {
            return;
        }
        startAttempt();
    }

    private void cancelRetry()
    {
        if (retryTask != null)
        {
            retryTask.cancel();
            retryTask = null;
        }
    }

    // ========== Keepalive ==========

    private void armKeepalive(long attemptId)
    {
        cancelKeepalive();
        keepaliveTask = scheduler.schedule(() -> checkKeepalive(attemptId), pingTimeout.dividedBy(2));
    }

    private void checkKeepalive(long attemptId)
    {
        keepaliveTask = null;
        if (!isCurrent(attemptId) || state != ConnectionState.OPEN)
        {
            return;
        }

        long silentMs = scheduler.nowMillis() - lastActivityMs;
        if (silentMs >= pingTimeout.toMillis())
        {
            LOG.warn("Connection #{} silent for {}ms, dropping it", attemptId, silentMs);
            onConnectionLost(ABNORMAL_CLOSURE, PING_TIMEOUT_REASON);
            return;
        }

        try
        {
            current.transport().ping();
        }
        catch (RuntimeException e)
        {
            LOG.warn("Connection #{} ping failed", attemptId, e);
            onConnectionLost(ABNORMAL_CLOSURE, "ping failed");
            return;
        }
        armKeepalive(attemptId);
    }

    private void cancelKeepalive()
    {
        if (keepaliveTask != null)
        {
            keepaliveTask.cancel();
            keepaliveTask = null;
        }
    }

    // ========== Helpers ==========

    private boolean isCurrent(long attemptId)
    {
        return current != null && current.attemptId() == attemptId;
    }

    /**
     * Closes the current transport locally, reporting the loss if it was open.
     */
    private void dropCurrent()
    {
        if (current == null)
        {
            return;
        }
        boolean wasOpen = state == ConnectionState.OPEN;
        long attemptId = current.attemptId();
        closeCurrentTransport();
        if (wasOpen)
        {
            callback.onConnectionLost(attemptId);
        }
    }

    private void closeCurrentTransport()
    {
        cancelKeepalive();
        if (current == null)
        {
            return;
        }
        Transport transport = current.transport();
        current = null;
        transport.close();
    }

    /**
     * Marshals one attempt's transport signals onto the event thread.
     */
    private class AttemptListener implements TransportListener
    {
        private final long attemptId;

        AttemptListener(long attemptId)
        {
            this.attemptId = attemptId;
        }

        @Override
        public void onConnected()
        {
            scheduler.execute(() -> onTransportConnected(attemptId));
        }

        @Override
        public void onMessage(String frame)
        {
            scheduler.execute(() -> onTransportMessage(attemptId, frame));
        }

        @Override
        public void onPong()
        {
            scheduler.execute(() -> onTransportPong(attemptId));
        }

        @Override
        public void onClosed(int code, String reason)
        {
            scheduler.execute(() -> onTransportClosed(attemptId, code, reason == null ? "" : reason));
        }

        @Override
        public void onConnectionError(Throwable error, boolean retryable)
        {
            scheduler.execute(() -> onTransportError(attemptId, error, retryable));
        }
    }
}
