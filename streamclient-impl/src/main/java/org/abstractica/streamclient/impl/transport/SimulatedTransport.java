package org.abstractica.streamclient.impl.transport;

import org.abstractica.streamclient.transport.Transport;
import org.abstractica.streamclient.transport.TransportFactory;
import org.abstractica.streamclient.transport.TransportListener;
import org.abstractica.streamclient.transport.TransportRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scripted transport for testing connection handling.
 *
 * <p>Nothing happens on its own: the test decides when a connection attempt
 * succeeds or fails, which frames the gateway sends, and when the gateway
 * drops the connection. Frames sent by the client are recorded.</p>
 *
 * <p>Use {@link Factory} to capture every transport a client creates.</p>
 */
public class SimulatedTransport implements Transport
{
    private static final Logger LOG = LoggerFactory.getLogger(SimulatedTransport.class);

    /**
     * Lifecycle of a simulated connection.
     */
    public enum State
    {
        CREATED,
        CONNECTING,
        OPEN,
        CLOSED
    }

    private final TransportRequest request;
    private final TransportListener listener;
    private final List<String> sentFrames = new CopyOnWriteArrayList<>();
    private final AtomicInteger pingCount = new AtomicInteger(0);

    private volatile State state = State.CREATED;
    private volatile boolean closedLocally = false;
    private volatile boolean answerPings = true;

    public SimulatedTransport(TransportRequest request, TransportListener listener)
    {
        this.request = Objects.requireNonNull(request, "request");
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    // ========== Transport Interface ==========

    @Override
    public void connect()
    {
        if (state != State.CREATED)
        {
            throw new IllegalStateException("Transport already connected: " + state);
        }
        state = State.CONNECTING;
    }

    @Override
    public void send(String frame)
    {
        Objects.requireNonNull(frame, "frame");
        if (state != State.OPEN)
        {
            LOG.debug("Dropping frame sent in state {}", state);
            return;
        }
        sentFrames.add(frame);
    }

    @Override
    public void ping()
    {
        if (state != State.OPEN)
        {
            return;
        }
        pingCount.incrementAndGet();
        if (answerPings)
        {
            listener.onPong();
        }
    }

    @Override
    public void close()
    {
        if (state != State.CLOSED)
        {
            closedLocally = true;
            state = State.CLOSED;
        }
    }

    // ========== Gateway Side ==========

    /**
     * Completes the pending connection attempt.
     */
    public void acceptConnection()
    {
        requireState(State.CONNECTING);
        state = State.OPEN;
        listener.onConnected();
    }

    /**
     * Fails the pending connection attempt.
     *
     * @param error     the failure
     * @param retryable whether the failure is retryable
     */
    public void rejectConnection(Throwable error, boolean retryable)
    {
        requireState(State.CONNECTING);
        state = State.CLOSED;
        listener.onConnectionError(error, retryable);
    }

    /**
     * Delivers a frame from the gateway.
     *
     * @param frame the frame text
     */
    public void deliver(String frame)
    {
        requireState(State.OPEN);
        listener.onMessage(frame);
    }

    /**
     * Closes the connection from the gateway side.
     *
     * @param code   close code
     * @param reason close reason
     */
    public void closeFromServer(int code, String reason)
    {
        if (state == State.CLOSED)
        {
            throw new IllegalStateException("Transport already closed");
        }
        state = State.CLOSED;
        listener.onClosed(code, reason);
    }

    /**
     * Fails the open connection, as a network error would.
     *
     * @param error the failure
     */
    public void fail(Throwable error)
    {
        requireState(State.OPEN);
        state = State.CLOSED;
        listener.onConnectionError(error, true);
    }

    /**
     * Sets whether pings are answered, simulating a silently dead connection when false.
     *
     * @param answer true to answer pings
     */
    public void answerPings(boolean answer)
    {
        this.answerPings = answer;
    }

    // ========== Inspection ==========

    public TransportRequest getRequest()
    {
        return request;
    }

    public State getState()
    {
        return state;
    }

    public boolean isClosedLocally()
    {
        return closedLocally;
    }

    public List<String> getSentFrames()
    {
        return new ArrayList<>(sentFrames);
    }

    public int getPingCount()
    {
        return pingCount.get();
    }

    private void requireState(State expected)
    {
        if (state != expected)
        {
            throw new IllegalStateException("Expected " + expected + " but was " + state);
        }
    }

    /**
     * Factory recording every transport it creates.
     */
    public static class Factory implements TransportFactory
    {
        private final List<SimulatedTransport> created = new CopyOnWriteArrayList<>();

        @Override
        public Transport create(TransportRequest request, TransportListener listener)
        {
            SimulatedTransport transport = new SimulatedTransport(request, listener);
            created.add(transport);
            return transport;
        }

        public List<SimulatedTransport> getCreated()
        {
            return new ArrayList<>(created);
        }

        public int count()
        {
            return created.size();
        }

        /**
         * Returns the most recently created transport.
         *
         * @return the latest transport
         * @throws IllegalStateException if none was created
         */
        public SimulatedTransport latest()
        {
            if (created.isEmpty())
            {
                throw new IllegalStateException("No transport created");
            }
            return created.get(created.size() - 1);
        }
    }
}
