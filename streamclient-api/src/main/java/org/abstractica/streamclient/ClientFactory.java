package org.abstractica.streamclient;

import org.abstractica.streamclient.transport.TransportFactory;

import java.time.Duration;

/**
 * Factory for creating StreamClient instances.
 *
 * <p>Use the builder to configure the client before creation:</p>
 * <pre>{@code
 * ClientFactory factory = new DefaultClientFactory();
 * StreamClient client = factory.builder()
 *     .uri("wss://gateway.example.com/")
 *     .apiKey(apiKey)
 *     .retryDelay(Duration.ofSeconds(5))
 *     .build();
 * }</pre>
 */
public interface ClientFactory
{
    /**
     * Creates a new client builder.
     *
     * @return a new builder instance
     */
    Builder builder();

    /**
     * Builder for configuring and creating a StreamClient.
     *
     * <p>Setters reject invalid values immediately.</p>
     */
    interface Builder
    {
        /**
         * Sets the gateway URI.
         *
         * <p>Must use the {@code ws} or {@code wss} scheme. A {@code sid} query
         * parameter selects the session to resume; other query parameters are
         * forwarded on connection.</p>
         *
         * @param uri the gateway URI
         * @return this builder
         * @throws IllegalArgumentException if the URI is malformed or has another scheme
         */
        Builder uri(String uri);

        /**
         * Sets whether the client connects as soon as it is built.
         *
         * <p>Optional. Defaults to true.</p>
         *
         * @param autoConnect true to connect on build
         * @return this builder
         */
        Builder autoConnect(boolean autoConnect);

        /**
         * Sets whether notifications are delivered on one aggregated channel.
         *
         * <p>Optional. Defaults to false (one channel per notification kind).</p>
         *
         * @param globalListener true for aggregated delivery
         * @return this builder
         */
        Builder globalListener(boolean globalListener);

        /**
         * Sets the session to resume.
         *
         * <p>Optional. Blank values are ignored.</p>
         *
         * @param sessionId the session identifier
         * @return this builder
         */
        Builder sessionId(String sessionId);

        /**
         * Sets the API key forwarded to the gateway.
         *
         * <p>Optional. Blank values are ignored.</p>
         *
         * @param apiKey the API key
         * @return this builder
         */
        Builder apiKey(String apiKey);

        /**
         * Sets how many consecutive failed connection attempts are retried.
         *
         * <p>Optional. Defaults to unbounded.</p>
         *
         * @param retryCount non-negative retry count
         * @return this builder
         * @throws IllegalArgumentException if negative
         */
        Builder retryCount(int retryCount);

        /**
         * Retries failed connection attempts forever.
         *
         * @return this builder
         */
        Builder unboundedRetries();

        /**
         * Sets the delay before each reconnection attempt.
         *
         * <p>Optional. Defaults to 10 seconds, minimum 1 second.</p>
         *
         * @param retryDelay the delay
         * @return this builder
         * @throws IllegalArgumentException if shorter than 1 second
         */
        Builder retryDelay(Duration retryDelay);

        /**
         * Sets how long an open connection may stay silent before it is dropped.
         *
         * <p>Optional. Defaults to 30 seconds, minimum 1 second.</p>
         *
         * @param pingTimeout the keepalive timeout
         * @return this builder
         * @throws IllegalArgumentException if shorter than 1 second
         */
        Builder pingTimeout(Duration pingTimeout);

        /**
         * Sets what happens to commands awaiting a reply when their connection is lost.
         *
         * <p>Optional. Defaults to {@link PendingCommandPolicy#FAIL_ON_RESET}.</p>
         *
         * @param policy the policy
         * @return this builder
         */
        Builder pendingCommandPolicy(PendingCommandPolicy policy);

        /**
         * Sets the transport factory used for each connection attempt.
         *
         * <p>Optional. Defaults to the JDK WebSocket transport.</p>
         *
         * @param transportFactory the transport factory
         * @return this builder
         */
        Builder transportFactory(TransportFactory transportFactory);

        /**
         * Builds the client.
         *
         * @return the configured client
         * @throws IllegalStateException if required parameters are missing
         */
        StreamClient build();
    }
}
