package org.abstractica.streamclient;

/**
 * A command did not produce a result.
 */
public abstract class CommandException extends RuntimeException
{
    private final String command;

    protected CommandException(String command, String message)
    {
        super(message);
        this.command = command;
    }

    /**
     * Returns the name of the failed command.
     *
     * @return command name
     */
    public String getCommand()
    {
        return command;
    }
}
