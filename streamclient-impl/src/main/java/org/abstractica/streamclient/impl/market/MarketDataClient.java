package org.abstractica.streamclient.impl.market;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.abstractica.streamclient.StreamClient;
import org.abstractica.streamclient.handlers.ResultHandler;

import java.util.List;
import java.util.Objects;

/**
 * Typed market-data commands on top of a {@link StreamClient}.
 *
 * <p>Each method validates its arguments, builds the command parameters and
 * issues the command. A null handler sends the command fire-and-forget.</p>
 *
 * <pre>{@code
 * MarketDataClient market = new MarketDataClient(client);
 * market.subscribeToTickers("binance", List.of("USDT-BTC"), false, null);
 * market.getPairs("binance", PairFilter.currency("USDT"), (result, error) -> { ... });
 * }</pre>
 */
public class MarketDataClient
{
    private static final JsonNodeFactory JSON = JsonNodeFactory.instance;

    private final StreamClient client;

    public MarketDataClient(StreamClient client)
    {
        this.client = Objects.requireNonNull(client, "client");
    }

    // ========== Pairs ==========

    /**
     * Lists the pairs of an exchange.
     *
     * @param exchange the exchange
     * @param filter   optional filter, or null
     * @param handler  receives the pairs (mandatory)
     */
    public void getPairs(String exchange, PairFilter filter, ResultHandler handler)
    {
        ObjectNode params = exchangeParams(exchange);
        Objects.requireNonNull(handler, "handler");
        if (filter != null)
        {
            params.putObject("filter").put(filter.field(), filter.value());
        }
        client.execute("getPairs", params, handler);
    }

    public void getPairs(String exchange, ResultHandler handler)
    {
        getPairs(exchange, null, handler);
    }

    // ========== Tickers ==========

    public void subscribeToTickers(String exchange, List<String> pairs, boolean reset, ResultHandler handler)
    {
        send("subscribeToTickers", subscribeParams(exchange, pairs, reset), handler);
    }

    public void subscribeToTickers(String exchange, List<String> pairs)
    {
        subscribeToTickers(exchange, pairs, false, null);
    }

    public void unsubscribeFromTickers(String exchange, List<String> pairs, ResultHandler handler)
    {
        send("unsubscribeFromTickers", pairParams(exchange, pairs), handler);
    }

    public void unsubscribeFromAllTickers(String exchange, ResultHandler handler)
    {
        send("unsubscribeFromAllTickers", exchangeParams(exchange), handler);
    }

    // ========== Order Books ==========

    public void subscribeToOrderBooks(String exchange, List<String> pairs, boolean reset, ResultHandler handler)
    {
        send("subscribeToOrderBooks", subscribeParams(exchange, pairs, reset), handler);
    }

    public void subscribeToOrderBooks(String exchange, List<String> pairs)
    {
        subscribeToOrderBooks(exchange, pairs, false, null);
    }

    /**
     * Requests a full order book snapshot for each pair.
     *
     * @param exchange the exchange
     * @param pairs    the pairs
     * @param handler  optional handler
     */
    public void resyncOrderBooks(String exchange, List<String> pairs, ResultHandler handler)
    {
        send("resyncOrderBooks", pairParams(exchange, pairs), handler);
    }

    public void unsubscribeFromOrderBooks(String exchange, List<String> pairs, ResultHandler handler)
    {
        send("unsubscribeFromOrderBooks", pairParams(exchange, pairs), handler);
    }

    public void unsubscribeFromAllOrderBooks(String exchange, ResultHandler handler)
    {
        send("unsubscribeFromAllOrderBooks", exchangeParams(exchange), handler);
    }

    // ========== Trades ==========

    public void subscribeToTrades(String exchange, List<String> pairs, boolean reset, ResultHandler handler)
    {
        send("subscribeToTrades", subscribeParams(exchange, pairs, reset), handler);
    }

    public void subscribeToTrades(String exchange, List<String> pairs)
    {
        subscribeToTrades(exchange, pairs, false, null);
    }

    public void unsubscribeFromTrades(String exchange, List<String> pairs, ResultHandler handler)
    {
        send("unsubscribeFromTrades", pairParams(exchange, pairs), handler);
    }

    public void unsubscribeFromAllTrades(String exchange, ResultHandler handler)
    {
        send("unsubscribeFromAllTrades", exchangeParams(exchange), handler);
    }

    // ========== Klines ==========

    public void subscribeToKlines(
            String exchange,
            List<String> pairs,
            String interval,
            boolean reset,
            ResultHandler handler
    )
    {
        ObjectNode params = pairParams(exchange, pairs);
        params.put("interval", checkInterval(interval));
        params.put("reset", reset);
        send("subscribeToKlines", params, handler);
    }

    public void subscribeToKlines(String exchange, List<String> pairs, String interval)
    {
        subscribeToKlines(exchange, pairs, interval, false, null);
    }

    /**
     * Unsubscribes from klines.
     *
     * @param exchange the exchange
     * @param pairs    the pairs
     * @param interval the interval, or null for all intervals
     * @param handler  optional handler
     */
    public void unsubscribeFromKlines(String exchange, List<String> pairs, String interval, ResultHandler handler)
    {
        ObjectNode params = pairParams(exchange, pairs);
        if (interval != null)
        {
            params.put("interval", checkInterval(interval));
        }
        send("unsubscribeFromKlines", params, handler);
    }

    public void unsubscribeFromAllKlines(String exchange, ResultHandler handler)
    {
        send("unsubscribeFromAllKlines", exchangeParams(exchange), handler);
    }

    // ========== Global ==========

    /**
     * Unsubscribes from everything on one exchange, or on all exchanges.
     *
     * @param exchange the exchange, or null for all exchanges
     * @param handler  optional handler
     */
    public void unsubscribe(String exchange, ResultHandler handler)
    {
        ObjectNode params = exchange == null ? JSON.objectNode() : exchangeParams(exchange);
        send("unsubscribe", params, handler);
    }

    // ========== Helpers ==========

    private void send(String command, ObjectNode params, ResultHandler handler)
    {
        if (handler == null)
        {
            client.execute(command, params);
        }
        else
        {
            client.execute(command, params, handler);
        }
    }

    private static ObjectNode exchangeParams(String exchange)
    {
        if (exchange == null || exchange.isEmpty())
        {
            throw new IllegalArgumentException("Exchange must be a non-empty string");
        }
        ObjectNode params = JSON.objectNode();
        params.put("exchange", exchange);
        return params;
    }

    private static ObjectNode pairParams(String exchange, List<String> pairs)
    {
        ObjectNode params = exchangeParams(exchange);
        if (pairs == null)
        {
            throw new IllegalArgumentException("Pairs must be a list");
        }
        ArrayNode array = params.putArray("pairs");
        for (String pair : pairs)
        {
            array.add(Objects.requireNonNull(pair, "pair"));
        }
        return params;
    }

    private static ObjectNode subscribeParams(String exchange, List<String> pairs, boolean reset)
    {
        ObjectNode params = pairParams(exchange, pairs);
        params.put("reset", reset);
        return params;
    }

    private static String checkInterval(String interval)
    {
        if (interval == null || interval.isEmpty())
        {
            throw new IllegalArgumentException("Interval must be a non-empty string");
        }
        return interval;
    }
}
