package org.abstractica.streamclient.impl.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.abstractica.streamclient.CommandException;
import org.abstractica.streamclient.CommandRejectedException;
import org.abstractica.streamclient.ConnectionEvent;
import org.abstractica.streamclient.ConnectionResetException;
import org.abstractica.streamclient.ConnectionState;
import org.abstractica.streamclient.Notification;
import org.abstractica.streamclient.NotificationKind;
import org.abstractica.streamclient.PendingCommandPolicy;
import org.abstractica.streamclient.StreamClient;
import org.abstractica.streamclient.impl.transport.SimulatedTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import java.util.function.UnaryOperator;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link DefaultStreamClient} driven by a simulated gateway.
 */
class DefaultStreamClientTest
{
    private static final Duration RETRY_DELAY = Duration.ofMillis(1000);
    private static final String HELLO_NEW = "{\"hello\":{\"sid\":\"s1\",\"isNew\":true}}";
    private static final String HELLO_RESUMED = "{\"hello\":{\"sid\":\"s1\",\"isNew\":false}}";

    private final ObjectMapper mapper = new ObjectMapper();

    private SimulatedTransport.Factory transports;
    private ManualScheduler scheduler;
    private List<ConnectionEvent> events;
    private StreamClient client;

    @BeforeEach
    void setUp()
    {
        transports = new SimulatedTransport.Factory();
        scheduler = new ManualScheduler();
        events = new ArrayList<>();
        client = newClient(b -> b);
    }

    private StreamClient newClient(UnaryOperator<DefaultClientFactory.DefaultBuilder> customizer)
    {
        DefaultClientFactory.DefaultBuilder builder = new DefaultClientFactory().builder()
                .uri("ws://localhost:8001/?expires=60")
                .autoConnect(false)
                .retryDelay(RETRY_DELAY)
                .transportFactory(transports)
                .scheduler(scheduler);
        StreamClient created = customizer.apply(builder).build();
        created.onConnectionEvent(events::add);
        return created;
    }

    private SimulatedTransport openLatest()
    {
        SimulatedTransport transport = transports.latest();
        transport.acceptConnection();
        scheduler.runPending();
        return transport;
    }

    private SimulatedTransport connectAndReady()
    {
        client.connect();
        scheduler.runPending();
        SimulatedTransport transport = openLatest();
        transport.deliver(HELLO_NEW);
        scheduler.runPending();
        return transport;
    }

    private JsonNode json(String frame)
    {
        try
        {
            return mapper.readTree(frame);
        }
        catch (Exception e)
        {
            throw new AssertionError("Invalid frame: " + frame, e);
        }
    }

    private List<ConnectionEvent> eventsOfType(Class<? extends ConnectionEvent> type)
    {
        List<ConnectionEvent> matching = new ArrayList<>();
        for (ConnectionEvent event : events)
        {
            if (type.isInstance(event))
            {
                matching.add(event);
            }
        }
        return matching;
    }

    // ========== Connecting ==========

    @Test
    void autoConnect_connectsOnBuild()
    {
        newClient(b -> b.autoConnect(true));
        scheduler.runPending();

        assertEquals(1, transports.count());
    }

    @Test
    void autoConnectDisabled_connectsLazilyOnFirstCommand()
    {
        scheduler.runPending();
        assertEquals(0, transports.count());
        assertEquals(ConnectionState.IDLE, client.getState());

        client.execute("subscribeToTickers", Map.of("exchange", "binance"));
        scheduler.runPending();

        assertEquals(1, transports.count());
        assertEquals(ConnectionState.CONNECTING, client.getState());
        assertEquals(1, client.getStats().getQueuedFrames());
    }

    @Test
    void apiKey_sentAsHandshakeHeader()
    {
        client = newClient(b -> b.apiKey(" secret "));
        client.connect();
        scheduler.runPending();

        assertEquals("secret", transports.latest().getRequest().headers().get("ApiKey"));
    }

    // ========== Ready And Buffering ==========

    @Test
    void bufferedCommands_flushedInOrderAfterSingleReady()
    {
        List<JsonNode> results = new ArrayList<>();
        client.execute("subscribeToTickers", Map.of("exchange", "binance"), (r, e) -> results.add(r));
        client.execute("subscribeToOrderBooks", Map.of("exchange", "binance"));
        scheduler.runPending();

        SimulatedTransport transport = openLatest();
        assertTrue(transport.getSentFrames().isEmpty());
        assertFalse(client.isReady());

        transport.deliver(HELLO_NEW);
        scheduler.runPending();

        assertEquals(1, eventsOfType(ConnectionEvent.Ready.class).size());
        assertEquals(new ConnectionEvent.Ready("s1", true), events.get(events.size() - 1));

        List<String> sent = transport.getSentFrames();
        assertEquals(2, sent.size());
        assertEquals("subscribeToTickers", json(sent.get(0)).get("m").asText());
        assertEquals(1, json(sent.get(0)).get("i").asLong());
        assertEquals("subscribeToOrderBooks", json(sent.get(1)).get("m").asText());
        assertFalse(json(sent.get(1)).has("i"));
        assertEquals(0, client.getStats().getQueuedFrames());
    }

    @Test
    void commandsAfterReady_sentImmediately()
    {
        SimulatedTransport transport = connectAndReady();

        client.execute("unsubscribe");
        scheduler.runPending();

        assertEquals(1, transport.getSentFrames().size());
        assertEquals("{\"m\":\"unsubscribe\"}", transport.getSentFrames().get(0));
    }

    @Test
    void framesBeforeHello_dropped()
    {
        List<Notification> tickers = new ArrayList<>();
        client.onNotification(NotificationKind.TICKER, tickers::add);
        client.connect();
        scheduler.runPending();
        SimulatedTransport transport = openLatest();

        transport.deliver("{\"n\":\"ticker\",\"d\":{\"pair\":\"USDT-BTC\"}}");
        scheduler.runPending();

        assertTrue(tickers.isEmpty());
        assertEquals(1, client.getStats().getFramesDropped());
    }

    @Test
    void malformedFrames_droppedSilently()
    {
        SimulatedTransport transport = connectAndReady();

        transport.deliver("garbage");
        transport.deliver("{\"unexpected\":true}");
        scheduler.runPending();

        assertEquals(2, client.getStats().getFramesDropped());
        assertTrue(scheduler.getErrors().isEmpty());
        assertEquals(ConnectionState.OPEN, client.getState());
    }

    @Test
    void resumedHello_doesNotRaiseReadyAgain()
    {
        SimulatedTransport first = connectAndReady();
        first.closeFromServer(1006, "");
        scheduler.runPending();
        scheduler.advance(RETRY_DELAY);

        SimulatedTransport second = openLatest();
        second.deliver(HELLO_RESUMED);
        scheduler.runPending();

        assertEquals(1, eventsOfType(ConnectionEvent.Ready.class).size());
        assertEquals("sid=s1", second.getRequest().uri().getQuery());
    }

    @Test
    void newSessionHello_raisesReadyAgain()
    {
        SimulatedTransport first = connectAndReady();
        first.closeFromServer(1006, "");
        scheduler.runPending();
        scheduler.advance(RETRY_DELAY);

        SimulatedTransport second = openLatest();
        second.deliver("{\"hello\":{\"sid\":\"s2\",\"isNew\":true}}");
        scheduler.runPending();

        List<ConnectionEvent> ready = eventsOfType(ConnectionEvent.Ready.class);
        assertEquals(2, ready.size());
        assertEquals(new ConnectionEvent.Ready("s2", true), ready.get(1));
        assertEquals(Optional.of("s2"), client.getSessionId());
    }

    @Test
    void commandsDuringReconnect_bufferedUntilNextHello()
    {
        SimulatedTransport first = connectAndReady();
        first.closeFromServer(1006, "");
        scheduler.runPending();

        client.execute("subscribeToTrades", Map.of("exchange", "kraken"));
        scheduler.runPending();
        assertEquals(1, client.getStats().getQueuedFrames());

        scheduler.advance(RETRY_DELAY);
        SimulatedTransport second = openLatest();
        client.execute("subscribeToKlines", Map.of("exchange", "kraken"));
        scheduler.runPending();
        assertTrue(second.getSentFrames().isEmpty());

        second.deliver(HELLO_RESUMED);
        scheduler.runPending();

        List<String> sent = second.getSentFrames();
        assertEquals(2, sent.size());
        assertEquals("subscribeToTrades", json(sent.get(0)).get("m").asText());
        assertEquals("subscribeToKlines", json(sent.get(1)).get("m").asText());
    }

    // ========== Results And Errors ==========

    @Test
    void call_completesWithResult()
    {
        SimulatedTransport transport = connectAndReady();

        CompletableFuture<JsonNode> future = client.call("getPairs", Map.of("exchange", "binance"));
        scheduler.runPending();
        long id = json(transport.getSentFrames().get(0)).get("i").asLong();
        transport.deliver("{\"i\":" + id + ",\"r\":[\"USDT-BTC\"]}");
        scheduler.runPending();

        assertTrue(future.isDone());
        assertEquals("USDT-BTC", future.join().get(0).asText());
        assertEquals(0, client.getStats().getPendingCommands());
    }

    @Test
    void call_failsWithRejection()
    {
        SimulatedTransport transport = connectAndReady();

        CompletableFuture<JsonNode> future = client.call("getPairs", Map.of("exchange", "nowhere"));
        scheduler.runPending();
        transport.deliver("{\"i\":1,\"e\":{\"message\":\"unknown exchange\"}}");
        scheduler.runPending();

        CompletionException thrown = assertThrows(CompletionException.class, future::join);
        CommandRejectedException rejected = assertInstanceOf(CommandRejectedException.class, thrown.getCause());
        assertEquals("unknown exchange", rejected.getError().get("message").asText());
    }

    @Test
    void unknownCorrelationId_ignored()
    {
        SimulatedTransport transport = connectAndReady();

        transport.deliver("{\"i\":99,\"r\":true}");
        transport.deliver("{\"i\":99,\"e\":{}}");
        scheduler.runPending();

        assertTrue(scheduler.getErrors().isEmpty());
        assertEquals(ConnectionState.OPEN, client.getState());
    }

    @Test
    void resultHandlerException_surfacesWithoutBreakingClient()
    {
        SimulatedTransport transport = connectAndReady();
        List<Notification> tickers = new ArrayList<>();
        client.onNotification(NotificationKind.TICKER, tickers::add);

        client.execute("getPairs", Map.of("exchange", "binance"), (r, e) -> {
            throw new IllegalStateException("handler bug");
        });
        scheduler.runPending();
        transport.deliver("{\"i\":1,\"r\":[]}");
        transport.deliver("{\"n\":\"ticker\",\"d\":{}}");
        scheduler.runPending();

        assertEquals(1, scheduler.getErrors().size());
        assertEquals("handler bug", scheduler.getErrors().get(0).getMessage());
        assertEquals(1, tickers.size());
    }

    // ========== Pending Commands On Reset ==========

    @Test
    void failOnReset_failsTransmittedCommandsOnly()
    {
        SimulatedTransport first = connectAndReady();
        CompletableFuture<JsonNode> transmitted = client.call("getPairs", Map.of("exchange", "binance"));
        scheduler.runPending();

        first.closeFromServer(1006, "");
        scheduler.runPending();
        CompletableFuture<JsonNode> buffered = client.call("getPairs", Map.of("exchange", "kraken"));
        scheduler.runPending();

        CompletionException thrown = assertThrows(CompletionException.class, transmitted::join);
        ConnectionResetException reset = assertInstanceOf(ConnectionResetException.class, thrown.getCause());
        assertEquals(1, reset.getAttemptId());
        assertFalse(buffered.isDone());

        scheduler.advance(RETRY_DELAY);
        SimulatedTransport second = openLatest();
        second.deliver(HELLO_RESUMED);
        second.deliver("{\"i\":2,\"r\":[\"XBT-EUR\"]}");
        scheduler.runPending();

        assertEquals("XBT-EUR", buffered.join().get(0).asText());
    }

    @Test
    void failOnReset_appliesToExplicitDisconnect()
    {
        connectAndReady();
        List<CommandException> errors = new ArrayList<>();
        client.execute("getPairs", Map.of("exchange", "binance"), (r, e) -> errors.add(e));
        scheduler.runPending();

        client.disconnect();
        scheduler.runPending();

        assertEquals(1, errors.size());
        assertInstanceOf(ConnectionResetException.class, errors.get(0));
        assertEquals(ConnectionState.IDLE, client.getState());
    }

    @Test
    void abandon_leavesTransmittedCommandsPending()
    {
        client = newClient(b -> b.pendingCommandPolicy(PendingCommandPolicy.ABANDON));
        SimulatedTransport first = connectAndReady();
        CompletableFuture<JsonNode> transmitted = client.call("getPairs", Map.of("exchange", "binance"));
        scheduler.runPending();

        first.closeFromServer(1006, "");
        scheduler.runPending();

        assertFalse(transmitted.isDone());
        assertEquals(1, client.getStats().getPendingCommands());
    }

    // ========== Notifications ==========

    @Test
    void perKindMode_routesByKind()
    {
        List<Notification> books = new ArrayList<>();
        client.onNotification(NotificationKind.ORDER_BOOK_UPDATE, books::add);
        SimulatedTransport transport = connectAndReady();

        transport.deliver("{\"n\":\"orderBookUpdate\",\"d\":{\"pair\":\"USDT-BTC\"}}");
        transport.deliver("{\"n\":\"ticker\",\"d\":{\"pair\":\"USDT-BTC\"}}");
        scheduler.runPending();

        assertEquals(1, books.size());
        assertEquals("USDT-BTC", books.get(0).payload().get("pair").asText());
        assertThrows(IllegalStateException.class, () -> client.onNotification(n -> { }));
    }

    @Test
    void aggregatedMode_deliversEverythingWithDiscriminator()
    {
        client = newClient(b -> b.globalListener(true));
        List<Notification> all = new ArrayList<>();
        client.onNotification(all::add);
        SimulatedTransport transport = connectAndReady();

        transport.deliver("{\"n\":\"kline\",\"d\":{\"interval\":\"5m\"}}");
        transport.deliver("{\"n\":\"trades\",\"d\":{\"pair\":\"A-B\"}}");
        scheduler.runPending();

        assertEquals(2, all.size());
        assertEquals("kline", all.get(0).payload().get("notification").asText());
        assertEquals("trades", all.get(1).payload().get("notification").asText());
        assertThrows(IllegalStateException.class,
                () -> client.onNotification(NotificationKind.TICKER, n -> { }));
    }

    @Test
    void connectionListenerException_doesNotBreakOthers()
    {
        List<ConnectionEvent> seen = new ArrayList<>();
        client.onConnectionEvent(e -> {
            throw new IllegalStateException("listener bug");
        });
        client.onConnectionEvent(seen::add);

        connectAndReady();

        assertEquals(2, seen.size());
        assertTrue(scheduler.getErrors().isEmpty());
    }

    // ========== Validation And Lifecycle ==========

    @Test
    void execute_validatesSynchronously()
    {
        assertThrows(IllegalArgumentException.class, () -> client.execute(""));
        assertThrows(NullPointerException.class, () -> client.execute(null, Map.of()));
        assertThrows(IllegalArgumentException.class, () -> client.execute("cmd", new Object()));
        assertThrows(NullPointerException.class, () -> client.execute("cmd", null, null));
    }

    @Test
    void introspection_reflectsSession()
    {
        assertFalse(client.isConnected());
        assertFalse(client.isReady());
        assertEquals(Optional.empty(), client.getSessionId());

        connectAndReady();

        assertTrue(client.isConnected());
        assertTrue(client.isReady());
        assertEquals(Optional.of("s1"), client.getSessionId());
        assertEquals(1, client.getStats().getConnectionAttempts());
        assertEquals(1, client.getStats().getFramesReceived());
    }

    @Test
    void initialOnlyParams_droppedAfterReady()
    {
        SimulatedTransport first = connectAndReady();
        assertEquals("expires=60", first.getRequest().uri().getQuery());

        first.closeFromServer(1006, "");
        scheduler.runPending();
        scheduler.advance(RETRY_DELAY);

        assertEquals("sid=s1", transports.latest().getRequest().uri().getQuery());
    }

    @Test
    void close_disconnectsAndRejectsFurtherUse()
    {
        SimulatedTransport transport = connectAndReady();

        client.close();
        scheduler.runPending();

        assertTrue(transport.isClosedLocally());
        assertTrue(scheduler.isClosed());
        assertThrows(IllegalStateException.class, () -> client.execute("unsubscribe"));
        assertThrows(IllegalStateException.class, () -> client.connect());
    }

    @Test
    void close_failsTransmittedCommands()
    {
        SimulatedTransport transport = connectAndReady();
        CompletableFuture<JsonNode> future = client.call("getPairs", null);
        scheduler.runPending();
        assertEquals(1, transport.getSentFrames().size());

        client.close();
        scheduler.runPending();

        CompletionException thrown = assertThrows(CompletionException.class, future::join);
        assertInstanceOf(ConnectionResetException.class, thrown.getCause());
        assertTrue(scheduler.isClosed());
    }

    @Test
    void close_failsTransmittedCommandsOnExecutorThread() throws Exception
    {
        StreamClient threaded = new DefaultClientFactory().builder()
                .uri("ws://localhost:8001")
                .transportFactory(transports)
                .build();

        awaitTrue(() -> transports.count() == 1
                && transports.latest().getState() == SimulatedTransport.State.CONNECTING);
        SimulatedTransport transport = transports.latest();
        transport.acceptConnection();
        transport.deliver(HELLO_NEW);
        awaitTrue(threaded::isReady);

        CompletableFuture<JsonNode> future = threaded.call("getPairs", null);
        awaitTrue(() -> transport.getSentFrames().size() == 1);
        assertEquals("{\"m\":\"getPairs\",\"i\":1}", transport.getSentFrames().get(0));

        threaded.close();

        ExecutionException thrown = assertThrows(ExecutionException.class,
                () -> future.get(5, TimeUnit.SECONDS));
        assertInstanceOf(ConnectionResetException.class, thrown.getCause());
        awaitTrue(transport::isClosedLocally);
    }

    private static void awaitTrue(BooleanSupplier condition) throws InterruptedException
    {
        long deadline = System.currentTimeMillis() + 5000;
        while (!condition.getAsBoolean())
        {
            if (System.currentTimeMillis() > deadline)
            {
                fail("Condition not met within 5 seconds");
            }
            Thread.sleep(10);
        }
    }
}
