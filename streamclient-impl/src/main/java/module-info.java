/**
 * Stream client implementation module.
 *
 * <p>Provides the default implementation of the stream client API.</p>
 */
module streamclient.impl
{
    requires streamclient.api;
    requires org.slf4j;
    requires com.fasterxml.jackson.databind;
    requires java.net.http;

    // Export factory, configuration and transports for external use
    exports org.abstractica.streamclient.impl.client;
    exports org.abstractica.streamclient.impl.session;
    exports org.abstractica.streamclient.impl.protocol;
    exports org.abstractica.streamclient.impl.transport;
    exports org.abstractica.streamclient.impl.market;
}
