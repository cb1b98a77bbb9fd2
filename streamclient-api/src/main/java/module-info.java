/**
 * Stream client API module.
 *
 * <p>Provides the interfaces for a session-resuming client of streaming
 * market-data gateways, and the transport SPI it connects through.</p>
 */
module streamclient.api
{
    requires transitive com.fasterxml.jackson.databind;

    exports org.abstractica.streamclient;
    exports org.abstractica.streamclient.handlers;
    exports org.abstractica.streamclient.transport;
}
