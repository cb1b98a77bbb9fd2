package org.abstractica.streamclient.transport;

/**
 * One physical connection attempt to the gateway.
 *
 * <p>A transport is single-use: it is connected at most once and never
 * reopened after it has closed. Outcomes of {@link #connect()} and all
 * inbound traffic are reported to the {@link TransportListener} it was
 * created with, possibly from another thread.</p>
 */
public interface Transport
{
    /**
     * Starts connecting. Returns immediately.
     */
    void connect();

    /**
     * Sends a text frame.
     *
     * @param frame the serialized frame
     */
    void send(String frame);

    /**
     * Sends a keepalive ping. The transport reports the answer via
     * {@link TransportListener#onPong()}.
     */
    void ping();

    /**
     * Closes the connection.
     *
     * <p>Closing locally does not produce an {@link TransportListener#onClosed}
     * callback. Safe to call more than once.</p>
     */
    void close();
}
