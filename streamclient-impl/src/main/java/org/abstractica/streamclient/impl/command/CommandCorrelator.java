package org.abstractica.streamclient.impl.command;

import com.fasterxml.jackson.databind.JsonNode;
import org.abstractica.streamclient.CommandRejectedException;
import org.abstractica.streamclient.handlers.ResultHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Matches command replies to the handlers waiting for them.
 *
 * <p>Correlation ids start at 1 and increase for the lifetime of the
 * correlator, so an id is never reused. A command is registered before its
 * frame leaves the client, which guarantees the handler is in place by the
 * time a reply can arrive.</p>
 *
 * <p>Replies for unknown ids (never issued, already answered, or failed by a
 * connection reset) are ignored. Exceptions thrown by a handler propagate to
 * the caller of {@link #deliverResult} or {@link #deliverError}.</p>
 *
 * <p>Not thread-safe. Owned by the client's event thread.</p>
 */
public class CommandCorrelator
{
    private static final Logger LOG = LoggerFactory.getLogger(CommandCorrelator.class);

    private final Map<Long, PendingCommand> pending;
    private long nextCorrelationId;

    public CommandCorrelator()
    {
        this.pending = new LinkedHashMap<>();
        this.nextCorrelationId = 1;
    }

    // ========== Registration ==========

    /**
     * Allocates a correlation id and registers the handler under it.
     *
     * @param command the command name
     * @param handler receives the reply
     * @param nowMs   current time
     * @return the allocated correlation id
     */
    public long register(String command, ResultHandler handler, long nowMs)
    {
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(handler, "handler");

        long correlationId = nextCorrelationId++;
        pending.put(correlationId, new PendingCommand(correlationId, command, nowMs, handler, null));
        return correlationId;
    }

    /**
     * Records that a command frame was handed to a connection.
     *
     * @param correlationId the command's correlation id
     * @param attemptId     the connection attempt that carried it
     */
    public void markTransmitted(long correlationId, long attemptId)
    {
        pending.computeIfPresent(correlationId, (id, entry) -> entry.withTransmittedOn(attemptId));
    }

    // ========== Delivery ==========

    /**
     * Delivers a result to the waiting handler.
     *
     * @param correlationId the id from the result frame
     * @param result        the result
     * @return true if a handler was waiting for this id
     */
    public boolean deliverResult(long correlationId, JsonNode result)
    {
        PendingCommand entry = pending.remove(correlationId);
        if (entry == null)
        {
            LOG.debug("Ignoring result for unknown correlation id {}", correlationId);
            return false;
        }
        entry.handler().handle(result, null);
        return true;
    }

    /**
     * Delivers an error to the waiting handler.
     *
     * @param correlationId the id from the error frame
     * @param error         the error object
     * @return true if a handler was waiting for this id
     */
    public boolean deliverError(long correlationId, JsonNode error)
    {
        PendingCommand entry = pending.remove(correlationId);
        if (entry == null)
        {
            LOG.debug("Ignoring error for unknown correlation id {}", correlationId);
            return false;
        }
        entry.handler().handle(null, new CommandRejectedException(entry.command(), error));
        return true;
    }

    // ========== Connection Reset ==========

    /**
     * Removes every command that was transmitted on a connection attempt.
     *
     * <p>Commands that are still buffered stay registered.</p>
     *
     * @param attemptId the lost connection attempt
     * @return the removed commands, in issue order
     */
    public List<PendingCommand> removeTransmittedOn(long attemptId)
    {
        List<PendingCommand> removed = new ArrayList<>();
        Iterator<PendingCommand> it = pending.values().iterator();
        while (it.hasNext())
        {
            PendingCommand entry = it.next();
            if (entry.transmittedOn() != null && entry.transmittedOn() == attemptId)
            {
                removed.add(entry);
                it.remove();
            }
        }
        return removed;
    }

    // ========== Queries ==========

    public boolean isPending(long correlationId)
    {
        return pending.containsKey(correlationId);
    }

    public int size()
    {
        return pending.size();
    }

    /**
     * Returns the id the next registered command will get.
     *
     * @return next correlation id
     */
    public long peekNextCorrelationId()
    {
        return nextCorrelationId;
    }
}
