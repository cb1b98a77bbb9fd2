package org.abstractica.streamclient.transport;

import java.net.URI;
import java.util.Map;
import java.util.Objects;

/**
 * Everything a transport needs to open one connection.
 *
 * @param uri     the full connection URI, including session query parameters
 * @param headers handshake headers to send
 */
public record TransportRequest(URI uri, Map<String, String> headers)
{
    public TransportRequest
    {
        Objects.requireNonNull(uri, "uri");
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }
}
