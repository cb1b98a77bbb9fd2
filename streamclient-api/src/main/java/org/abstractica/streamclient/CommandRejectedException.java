package org.abstractica.streamclient;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * The gateway answered a command with an error frame.
 */
public class CommandRejectedException extends CommandException
{
    private final transient JsonNode error;

    public CommandRejectedException(String command, JsonNode error)
    {
        super(command, "Command '" + command + "' rejected: " + error);
        this.error = Objects.requireNonNull(error, "error");
    }

    /**
     * Returns the error object sent by the gateway.
     *
     * @return error payload
     */
    public JsonNode getError()
    {
        return error;
    }
}
