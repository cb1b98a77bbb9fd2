package org.abstractica.streamclient;

/**
 * What happens to a command awaiting its reply when its connection is lost.
 *
 * <p>Only commands already handed to the lost connection are affected.
 * Commands still buffered are sent once the next session is ready.</p>
 */
public enum PendingCommandPolicy
{
    /**
     * Fail the command with a {@link ConnectionResetException}.
     */
    FAIL_ON_RESET,

    /**
     * Leave the command unresolved. A late reply is still delivered.
     */
    ABANDON
}
