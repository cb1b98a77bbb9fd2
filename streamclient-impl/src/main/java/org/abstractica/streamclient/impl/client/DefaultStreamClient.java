package org.abstractica.streamclient.impl.client;

import com.fasterxml.jackson.databind.JsonNode;
import org.abstractica.streamclient.ClientStats;
import org.abstractica.streamclient.ConnectionEvent;
import org.abstractica.streamclient.ConnectionResetException;
import org.abstractica.streamclient.ConnectionState;
import org.abstractica.streamclient.NotificationKind;
import org.abstractica.streamclient.PendingCommandPolicy;
import org.abstractica.streamclient.StreamClient;
import org.abstractica.streamclient.handlers.ConnectionListener;
import org.abstractica.streamclient.handlers.NotificationListener;
import org.abstractica.streamclient.handlers.ResultHandler;
import org.abstractica.streamclient.impl.command.CommandCorrelator;
import org.abstractica.streamclient.impl.command.PendingCommand;
import org.abstractica.streamclient.impl.events.EventRouter;
import org.abstractica.streamclient.impl.outbound.OutboundBuffer;
import org.abstractica.streamclient.impl.outbound.QueuedMessage;
import org.abstractica.streamclient.impl.protocol.FrameCodec;
import org.abstractica.streamclient.impl.protocol.InboundFrame;
import org.abstractica.streamclient.impl.protocol.OutboundCommand;
import org.abstractica.streamclient.impl.session.SessionManager;
import org.abstractica.streamclient.transport.TransportRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Default implementation of the StreamClient interface.
 *
 * <p>Public methods validate their arguments on the calling thread and hand
 * the work to the client's {@link Scheduler}. Everything else (transport
 * signals, timers, frame handling) already runs there, so the session,
 * correlator and buffer are only ever touched by one thread.</p>
 *
 * <p>Inbound frame flow:</p>
 * <ol>
 *   <li>hello: recorded by the {@link SessionManager}, ready announced if
 *       needed, then the {@link OutboundBuffer} is flushed</li>
 *   <li>anything before the first hello: dropped</li>
 *   <li>result/error: delivered by the {@link CommandCorrelator}</li>
 *   <li>notification: routed by the {@link EventRouter}</li>
 * </ol>
 */
public class DefaultStreamClient implements StreamClient
{
    private static final Logger LOG = LoggerFactory.getLogger(DefaultStreamClient.class);

    private final ClientConfig config;
    private final Scheduler scheduler;
    private final FrameCodec codec;
    private final SessionManager session;
    private final CommandCorrelator correlator;
    private final OutboundBuffer buffer;
    private final EventRouter router;
    private final ConnectionSupervisor supervisor;
    private final DefaultClientStats stats;
    private final List<ConnectionListener> connectionListeners;
    private final AtomicBoolean closed;

    /**
     * Creates a new client.
     */
    DefaultStreamClient(ClientConfig config, Scheduler scheduler, FrameCodec codec)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.codec = Objects.requireNonNull(codec, "codec");

        this.session = new SessionManager(config.address(), config.sessionId());
        this.correlator = new CommandCorrelator();
        this.buffer = new OutboundBuffer();
        this.router = new EventRouter(config.globalListener()
                ? EventRouter.Mode.AGGREGATED
                : EventRouter.Mode.PER_KIND);
        this.stats = new DefaultClientStats();
        this.supervisor = new ConnectionSupervisor(config, scheduler, new Callback(), stats);
        this.connectionListeners = new CopyOnWriteArrayList<>();
        this.closed = new AtomicBoolean(false);

        if (config.autoConnect())
        {
            scheduler.execute(supervisor::connect);
        }
    }

    // ========== StreamClient Interface ==========

    @Override
    public void connect()
    {
        ensureOpen();
        scheduler.execute(supervisor::connect);
    }

    @Override
    public void reconnect()
    {
        ensureOpen();
        scheduler.execute(supervisor::reconnect);
    }

    @Override
    public void disconnect()
    {
        ensureOpen();
        scheduler.execute(supervisor::disconnect);
    }

    @Override
    public void close()
    {
        if (!closed.compareAndSet(false, true))
        {
            return;
        }
        LOG.info("Closing client");
        // The scheduler is released by the disconnect task itself, after the reset failures ran
        scheduler.execute(() -> {
            try
            {
                supervisor.disconnect();
            }
            finally
            {
                scheduler.close();
            }
        });
    }

    @Override
    public void execute(String command)
    {
        execute(command, null);
    }

    @Override
    public void execute(String command, Object params)
    {
        checkCommand(command);
        JsonNode json = codec.toParams(params);
        ensureOpen();
        scheduler.execute(() -> dispatch(OutboundCommand.fireAndForget(command, json)));
    }

    @Override
    public void execute(String command, Object params, ResultHandler handler)
    {
        checkCommand(command);
        Objects.requireNonNull(handler, "handler");
        JsonNode json = codec.toParams(params);
        ensureOpen();
        scheduler.execute(() -> {
            long correlationId = correlator.register(command, handler, scheduler.nowMillis());
            dispatch(OutboundCommand.correlated(command, json, correlationId));
        });
    }

    @Override
    public CompletableFuture<JsonNode> call(String command, Object params)
    {
        CompletableFuture<JsonNode> future = new CompletableFuture<>();
        execute(command, params, (result, error) -> {
            if (error != null)
            {
                future.completeExceptionally(error);
            }
            else
            {
                future.complete(result);
            }
        });
        return future;
    }

    @Override
    public void onConnectionEvent(ConnectionListener listener)
    {
        Objects.requireNonNull(listener, "listener");
        connectionListeners.add(listener);
    }

    @Override
    public void onNotification(NotificationKind kind, NotificationListener listener)
    {
        Objects.requireNonNull(kind, "kind");
        router.addListener(kind.getWireName(), listener);
    }

    @Override
    public void onNotification(String name, NotificationListener listener)
    {
        router.addListener(name, listener);
    }

    @Override
    public void onNotification(NotificationListener listener)
    {
        router.addListener(listener);
    }

    @Override
    public Optional<String> getSessionId()
    {
        return session.getSessionId();
    }

    @Override
    public boolean isConnected()
    {
        return supervisor.isOpen();
    }

    @Override
    public boolean isReady()
    {
        return session.isReady();
    }

    @Override
    public ConnectionState getState()
    {
        return supervisor.getState();
    }

    @Override
    public ClientStats getStats()
    {
        return stats;
    }

    public ClientConfig getConfig()
    {
        return config;
    }

    // ========== Outbound Path ==========

    private void dispatch(OutboundCommand command)
    {
        String frame = codec.encode(command);

        if (supervisor.getState() == ConnectionState.IDLE)
        {
            supervisor.connect();
        }

        if (!supervisor.isOpen() || !session.isReady() || !buffer.isEmpty())
        {
            buffer.enqueue(new QueuedMessage(command, frame, scheduler.nowMillis()));
        }
        else
        {
            transmit(command, frame);
        }
        updateQueueStats();
    }

    private void transmit(OutboundCommand command, String frame)
    {
        long attemptId = supervisor.send(frame);
        if (command.expectsReply())
        {
            correlator.markTransmitted(command.correlationId(), attemptId);
        }
        LOG.debug("Sent '{}' on connection #{}", command.method(), attemptId);
    }

    private void flush()
    {
        if (!supervisor.isOpen())
        {
            return;
        }
        buffer.flush(message -> transmit(message.command(), message.frame()));
    }

    // ========== Inbound Path ==========

    private void handleFrame(long attemptId, String text)
    {
        stats.recordFrameReceived();

        Optional<InboundFrame> decoded = codec.decode(text);
        if (decoded.isEmpty())
        {
            LOG.debug("Dropping malformed frame on connection #{}", attemptId);
            stats.recordFrameDropped();
            return;
        }

        InboundFrame frame = decoded.get();
        if (frame instanceof InboundFrame.Hello hello)
        {
            handleHello(hello);
            return;
        }

        if (!session.isReady())
        {
            LOG.debug("Dropping {} received before hello", frame.getClass().getSimpleName());
            stats.recordFrameDropped();
            return;
        }

        try
        {
            if (frame instanceof InboundFrame.Result result)
            {
                correlator.deliverResult(result.correlationId(), result.result());
            }
            else if (frame instanceof InboundFrame.ErrorReply error)
            {
                correlator.deliverError(error.correlationId(), error.error());
            }
            else if (frame instanceof InboundFrame.NotificationFrame notification)
            {
                router.route(notification);
            }
        }
        finally
        {
            updateQueueStats();
        }
    }

    private void handleHello(InboundFrame.Hello hello)
    {
        LOG.debug("Received hello: sid = '{}', isNew = {}", hello.sessionId(), hello.isNew());
        if (session.onHello(hello, scheduler.nowMillis()))
        {
            LOG.info("Session '{}' ready (new = {})", hello.sessionId(), hello.isNew());
            publish(new ConnectionEvent.Ready(hello.sessionId(), hello.isNew()));
        }
        flush();
        updateQueueStats();
    }

    private void handleConnectionLost(long attemptId)
    {
        if (config.pendingCommandPolicy() != PendingCommandPolicy.FAIL_ON_RESET)
        {
            return;
        }
        List<PendingCommand> lost = correlator.removeTransmittedOn(attemptId);
        if (!lost.isEmpty())
        {
            LOG.debug("Failing {} command(s) sent on connection #{}", lost.size(), attemptId);
        }
        for (PendingCommand entry : lost)
        {
            ConnectionResetException error = new ConnectionResetException(entry.command(), attemptId);
            if (closed.get())
            {
                // Closing: no later task will run, so fail the command now
                failInline(entry, error);
            }
            else
            {
                // One task per handler, so a failing handler cannot starve the others
                scheduler.execute(() -> entry.handler().handle(null, error));
            }
        }
        updateQueueStats();
    }

    // ========== Helpers ==========

    private void publish(ConnectionEvent event)
    {
        for (ConnectionListener listener : connectionListeners)
        {
            safeCallback(() -> listener.onEvent(event));
        }
    }

    private void safeCallback(Runnable callback)
    {
        try
        {
            callback.run();
        }
        catch (Exception e)
        {
            LOG.error("Connection listener error", e);
        }
    }

    private void failInline(PendingCommand entry, ConnectionResetException error)
    {
        try
        {
            entry.handler().handle(null, error);
        }
        catch (Exception e)
        {
            LOG.error("Result handler error for '{}'", entry.command(), e);
        }
    }

    private void updateQueueStats()
    {
        stats.updateQueues(buffer.size(), correlator.size());
    }

    private void ensureOpen()
    {
        if (closed.get())
        {
            throw new IllegalStateException("Client is closed");
        }
    }

    private static void checkCommand(String command)
    {
        Objects.requireNonNull(command, "command");
        if (command.isBlank())
        {
            throw new IllegalArgumentException("Command name must not be empty");
        }
    }

    /**
     * Connects the supervisor to this client's session, buffer and listeners.
     */
    private class Callback implements SupervisorCallback
    {
        @Override
        public TransportRequest nextRequest()
        {
            return new TransportRequest(session.connectionUri(), config.handshakeHeaders());
        }

        @Override
        public void onFrame(long attemptId, String frame)
        {
            handleFrame(attemptId, frame);
        }

        @Override
        public void onConnectionLost(long attemptId)
        {
            handleConnectionLost(attemptId);
        }

        @Override
        public void onConnectionEvent(ConnectionEvent event)
        {
            publish(event);
        }
    }
}
