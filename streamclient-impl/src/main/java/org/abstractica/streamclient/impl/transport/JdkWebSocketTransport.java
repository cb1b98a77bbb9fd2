package org.abstractica.streamclient.impl.transport;

import org.abstractica.streamclient.transport.Transport;
import org.abstractica.streamclient.transport.TransportFactory;
import org.abstractica.streamclient.transport.TransportListener;
import org.abstractica.streamclient.transport.TransportRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.net.http.WebSocketHandshakeException;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Transport over {@link java.net.http.WebSocket}.
 *
 * <p>Text frames split into several parts are reassembled before they are
 * reported. Outbound sends are chained so that only one is outstanding at a
 * time, as the JDK WebSocket requires.</p>
 *
 * <p>Handshake failures with status 401, 403 or 404, and invalid requests,
 * are reported as not retryable. Everything else (refused connections,
 * timeouts, server errors) is retryable.</p>
 */
public class JdkWebSocketTransport implements Transport
{
    private static final Logger LOG = LoggerFactory.getLogger(JdkWebSocketTransport.class);

    /**
     * Default time allowed for the opening handshake.
     */
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(30);

    private static final Set<Integer> NON_RETRYABLE_STATUS = Set.of(401, 403, 404);

    private final HttpClient http;
    private final TransportRequest request;
    private final TransportListener listener;
    private final Duration connectTimeout;

    private final AtomicBoolean connectStarted = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final Object sendLock = new Object();
    private final StringBuilder textBuffer = new StringBuilder();

    private volatile WebSocket webSocket;
    private CompletableFuture<WebSocket> sendChain = CompletableFuture.completedFuture(null);

    public JdkWebSocketTransport(
            HttpClient http,
            TransportRequest request,
            TransportListener listener,
            Duration connectTimeout
    )
    {
        this.http = Objects.requireNonNull(http, "http");
        this.request = Objects.requireNonNull(request, "request");
        this.listener = Objects.requireNonNull(listener, "listener");
        this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
    }

    // ========== Transport Interface ==========

    @Override
    public void connect()
    {
        if (!connectStarted.compareAndSet(false, true))
        {
            throw new IllegalStateException("Transport already connected");
        }

        CompletableFuture<WebSocket> opening;
        try
        {
            WebSocket.Builder builder = http.newWebSocketBuilder()
                    .connectTimeout(connectTimeout);
            for (Map.Entry<String, String> header : request.headers().entrySet())
            {
                builder.header(header.getKey(), header.getValue());
            }
            opening = builder.buildAsync(request.uri(), new Listener());
        }
        catch (IllegalArgumentException e)
        {
            closed.set(true);
            listener.onConnectionError(e, false);
            return;
        }

        opening.whenComplete((ws, error) -> {
            if (error == null)
            {
                return;
            }
            Throwable cause = unwrap(error);
            if (closed.getAndSet(true))
            {
                LOG.debug("Handshake failed after local close: {}", cause.toString());
                return;
            }
            listener.onConnectionError(cause, isRetryable(cause));
        });
    }

    @Override
    public void send(String frame)
    {
        Objects.requireNonNull(frame, "frame");
        WebSocket ws = webSocket;
        if (ws == null || closed.get())
        {
            LOG.debug("Dropping frame, transport not open");
            return;
        }
        chain(() -> ws.sendText(frame, true), "send");
    }

    @Override
    public void ping()
    {
        WebSocket ws = webSocket;
        if (ws == null || closed.get())
        {
            return;
        }
        chain(() -> ws.sendPing(ByteBuffer.allocate(0)), "ping");
    }

    @Override
    public void close()
    {
        if (closed.getAndSet(true))
        {
            return;
        }
        WebSocket ws = webSocket;
        if (ws == null)
        {
            return;
        }
        synchronized (sendLock)
        {
            sendChain = sendChain
                    .exceptionally(e -> null)
                    .thenCompose(v -> ws.sendClose(WebSocket.NORMAL_CLOSURE, "client disconnect"))
                    .whenComplete((w, e) -> ws.abort());
        }
    }

    public boolean isOpen()
    {
        return webSocket != null && !closed.get();
    }

    // ========== Helpers ==========

    private void chain(SendOperation operation, String what)
    {
        synchronized (sendLock)
        {
            sendChain = sendChain
                    .thenCompose(v -> operation.start())
                    .exceptionally(e -> {
                        LOG.warn("WebSocket {} failed: {}", what, unwrap(e).toString());
                        return null;
                    });
        }
    }

    static boolean isRetryable(Throwable error)
    {
        if (error instanceof WebSocketHandshakeException handshake)
        {
            int status = handshake.getResponse().statusCode();
            return !NON_RETRYABLE_STATUS.contains(status);
        }
        return !(error instanceof IllegalArgumentException);
    }

    private static Throwable unwrap(Throwable error)
    {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null)
        {
            current = current.getCause();
        }
        return current;
    }

    @FunctionalInterface
    private interface SendOperation
    {
        CompletableFuture<WebSocket> start();
    }

    /**
     * Receives the JDK WebSocket callbacks and forwards them to the transport listener.
     */
    private class Listener implements WebSocket.Listener
    {
        @Override
        public void onOpen(WebSocket ws)
        {
            if (closed.get())
            {
                ws.abort();
                return;
            }
            webSocket = ws;
            LOG.debug("WebSocket open: {}", request.uri());
            listener.onConnected();
            ws.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket ws, CharSequence data, boolean last)
        {
            textBuffer.append(data);
            if (last)
            {
                String frame = textBuffer.toString();
                textBuffer.setLength(0);
                listener.onMessage(frame);
            }
            ws.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onBinary(WebSocket ws, ByteBuffer data, boolean last)
        {
            LOG.debug("Ignoring binary frame ({} bytes)", data.remaining());
            ws.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onPong(WebSocket ws, ByteBuffer message)
        {
            listener.onPong();
            ws.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket ws, int statusCode, String reason)
        {
            if (!closed.getAndSet(true))
            {
                listener.onClosed(statusCode, reason);
            }
            return null;
        }

        @Override
        public void onError(WebSocket ws, Throwable error)
        {
            if (!closed.getAndSet(true))
            {
                listener.onConnectionError(error, true);
            }
        }
    }

    /**
     * Creates JDK WebSocket transports sharing one HttpClient.
     */
    public static class Factory implements TransportFactory
    {
        private final HttpClient http;
        private final Duration connectTimeout;

        public Factory()
        {
            this(HttpClient.newHttpClient(), DEFAULT_CONNECT_TIMEOUT);
        }

        public Factory(HttpClient http, Duration connectTimeout)
        {
            this.http = Objects.requireNonNull(http, "http");
            this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
        }

        @Override
        public Transport create(TransportRequest request, TransportListener listener)
        {
            return new JdkWebSocketTransport(http, request, listener, connectTimeout);
        }
    }
}
