package org.abstractica.streamclient.impl.client;

import org.abstractica.streamclient.ClientFactory;
import org.abstractica.streamclient.PendingCommandPolicy;
import org.abstractica.streamclient.StreamClient;
import org.abstractica.streamclient.impl.protocol.FrameCodec;
import org.abstractica.streamclient.impl.session.ConnectionAddress;
import org.abstractica.streamclient.impl.transport.JdkWebSocketTransport;
import org.abstractica.streamclient.transport.TransportFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Default implementation of ClientFactory.
 */
public class DefaultClientFactory implements ClientFactory
{
    @Override
    public DefaultBuilder builder()
    {
        return new DefaultBuilder();
    }

    public static class DefaultBuilder implements Builder
    {
        private ConnectionAddress address;
        private boolean autoConnect = true;
        private boolean globalListener = false;
        private String sessionId;
        private String apiKey;
        private int retryCount = ClientConfig.UNBOUNDED_RETRIES;
        private Duration retryDelay = ClientConfig.DEFAULT_RETRY_DELAY;
        private Duration pingTimeout = ClientConfig.DEFAULT_PING_TIMEOUT;
        private PendingCommandPolicy pendingCommandPolicy = PendingCommandPolicy.FAIL_ON_RESET;
        private TransportFactory transportFactory; // Optional (defaults to JDK WebSocket)
        private Scheduler scheduler; // Optional (defaults to a single daemon thread)
        private FrameCodec codec;

        @Override
        public DefaultBuilder uri(String uri)
        {
            this.address = ConnectionAddress.parse(uri);
            return this;
        }

        @Override
        public DefaultBuilder autoConnect(boolean autoConnect)
        {
            this.autoConnect = autoConnect;
            return this;
        }

        @Override
        public DefaultBuilder globalListener(boolean globalListener)
        {
            this.globalListener = globalListener;
            return this;
        }

        @Override
        public DefaultBuilder sessionId(String sessionId)
        {
            this.sessionId = trimToNull(sessionId);
            return this;
        }

        @Override
        public DefaultBuilder apiKey(String apiKey)
        {
            this.apiKey = trimToNull(apiKey);
            return this;
        }

        @Override
        public DefaultBuilder retryCount(int retryCount)
        {
            if (retryCount < 0)
            {
                throw new IllegalArgumentException("Retry count must be >= 0: " + retryCount);
            }
            this.retryCount = retryCount;
            return this;
        }

        @Override
        public DefaultBuilder unboundedRetries()
        {
            this.retryCount = ClientConfig.UNBOUNDED_RETRIES;
            return this;
        }

        @Override
        public DefaultBuilder retryDelay(Duration retryDelay)
        {
            Objects.requireNonNull(retryDelay, "retryDelay");
            ClientConfig.checkRetryDelay(retryDelay);
            this.retryDelay = retryDelay;
            return this;
        }

        @Override
        public DefaultBuilder pingTimeout(Duration pingTimeout)
        {
            Objects.requireNonNull(pingTimeout, "pingTimeout");
            ClientConfig.checkPingTimeout(pingTimeout);
            this.pingTimeout = pingTimeout;
            return this;
        }

        @Override
        public DefaultBuilder pendingCommandPolicy(PendingCommandPolicy policy)
        {
            this.pendingCommandPolicy = Objects.requireNonNull(policy, "policy");
            return this;
        }

        @Override
        public DefaultBuilder transportFactory(TransportFactory transportFactory)
        {
            this.transportFactory = Objects.requireNonNull(transportFactory, "transportFactory");
            return this;
        }

        /**
         * Sets the scheduler running the client's protocol logic.
         *
         * <p>If not set, each client gets its own {@link ExecutorScheduler}.
         * Tests pass a manually driven scheduler to control time.</p>
         *
         * @param scheduler the scheduler to use
         * @return this builder
         */
        public DefaultBuilder scheduler(Scheduler scheduler)
        {
            this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
            return this;
        }

        /**
         * Sets the codec used for wire frames.
         *
         * @param codec the codec to use
         * @return this builder
         */
        public DefaultBuilder codec(FrameCodec codec)
        {
            this.codec = Objects.requireNonNull(codec, "codec");
            return this;
        }

        /**
         * Builds the validated configuration without creating a client.
         *
         * @return the configuration
         */
        public ClientConfig buildConfig()
        {
            if (address == null)
            {
                throw new IllegalStateException("URI must be specified");
            }

            TransportFactory transports = (transportFactory != null)
                    ? transportFactory
                    : new JdkWebSocketTransport.Factory();

            return new ClientConfig(
                    address,
                    autoConnect,
                    globalListener,
                    sessionId,
                    apiKey,
                    retryCount,
                    retryDelay,
                    pingTimeout,
                    pendingCommandPolicy,
                    transports
            );
        }

        @Override
        public StreamClient build()
        {
            ClientConfig config = buildConfig();
            Scheduler sched = (scheduler != null) ? scheduler : new ExecutorScheduler();
            FrameCodec frameCodec = (codec != null) ? codec : new FrameCodec();
            return new DefaultStreamClient(config, sched, frameCodec);
        }

        private static String trimToNull(String value)
        {
            if (value == null)
            {
                return null;
            }
            String trimmed = value.trim();
            return trimmed.isEmpty() ? null : trimmed;
        }
    }
}
