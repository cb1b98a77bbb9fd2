package org.abstractica.streamclient.transport;

/**
 * Receives signals from a {@link Transport}.
 */
public interface TransportListener
{
    /**
     * The connection is open.
     */
    void onConnected();

    /**
     * A text frame arrived.
     *
     * @param frame the raw frame
     */
    void onMessage(String frame);

    /**
     * A keepalive ping was answered.
     */
    void onPong();

    /**
     * The remote side closed the connection.
     *
     * @param code   close code
     * @param reason close reason, possibly empty
     */
    void onClosed(int code, String reason);

    /**
     * The connection failed, either while connecting or while open.
     *
     * @param error     the failure
     * @param retryable false if retrying cannot succeed (e.g. rejected credentials)
     */
    void onConnectionError(Throwable error, boolean retryable);
}
