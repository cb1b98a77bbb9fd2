package org.abstractica.streamclient.transport;

/**
 * Creates one {@link Transport} per connection attempt.
 */
@FunctionalInterface
public interface TransportFactory
{
    /**
     * Creates an unconnected transport.
     *
     * @param request  where and how to connect
     * @param listener receives the transport's signals
     * @return a new transport
     */
    Transport create(TransportRequest request, TransportListener listener);
}
