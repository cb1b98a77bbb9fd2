package org.abstractica.streamclient;

/**
 * The connection carrying a command was lost before its reply arrived.
 */
public class ConnectionResetException extends CommandException
{
    private final long attemptId;

    public ConnectionResetException(String command, long attemptId)
    {
        super(command, "Connection #" + attemptId + " was reset before command '" + command + "' was answered");
        this.attemptId = attemptId;
    }

    /**
     * Returns the connection attempt that carried the command.
     *
     * @return attempt id
     */
    public long getAttemptId()
    {
        return attemptId;
    }
}
