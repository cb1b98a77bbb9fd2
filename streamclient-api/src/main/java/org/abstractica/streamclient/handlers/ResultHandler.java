package org.abstractica.streamclient.handlers;

import com.fasterxml.jackson.databind.JsonNode;
import org.abstractica.streamclient.CommandException;

/**
 * Receives the reply to a command.
 *
 * <p>Invoked at most once, with exactly one of the arguments non-null.
 * Exceptions thrown by the handler are not caught by the client's
 * correlation logic.</p>
 */
@FunctionalInterface
public interface ResultHandler
{
    /**
     * Handles a command reply.
     *
     * @param result the result, or null on failure
     * @param error  the failure, or null on success
     */
    void handle(JsonNode result, CommandException error);
}
