package org.abstractica.streamclient.impl.session;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Gateway address and the query parameters sent with each connection.
 *
 * <p>The {@code sid} parameter of the configured URI is taken as the session
 * to resume; all other parameters are forwarded on every connection, except
 * {@code expires} and {@code timeout}, which only apply until the session has
 * been ready once.</p>
 */
public final class ConnectionAddress
{
    static final String SESSION_PARAM = "sid";
    private static final Set<String> INITIAL_ONLY_PARAMS = Set.of("expires", "timeout");

    private final String baseUri;
    private final Map<String, String> queryParams;
    private final String sessionId;

    private ConnectionAddress(String baseUri, Map<String, String> queryParams, String sessionId)
    {
        this.baseUri = baseUri;
        this.queryParams = Collections.unmodifiableMap(queryParams);
        this.sessionId = sessionId;
    }

    /**
     * Parses and validates a gateway URI.
     *
     * @param uri the URI, {@code ws://} or {@code wss://}
     * @return the address
     * @throws IllegalArgumentException if the URI is malformed or has another scheme
     */
    public static ConnectionAddress parse(String uri)
    {
        Objects.requireNonNull(uri, "uri");

        URI parsed;
        try
        {
            parsed = new URI(uri.trim());
        }
        catch (URISyntaxException e)
        {
            throw new IllegalArgumentException("Invalid URI: " + uri, e);
        }

        String scheme = parsed.getScheme();
        if (scheme == null || !(scheme.equalsIgnoreCase("ws") || scheme.equalsIgnoreCase("wss")))
        {
            throw new IllegalArgumentException("URI scheme must be ws or wss: " + uri);
        }
        if (parsed.getRawAuthority() == null || parsed.getHost() == null)
        {
            throw new IllegalArgumentException("URI must have a host: " + uri);
        }
        if (parsed.getRawFragment() != null)
        {
            throw new IllegalArgumentException("URI must not have a fragment: " + uri);
        }

        String path = parsed.getRawPath();
        if (path == null || path.isEmpty())
        {
            path = "/";
        }
        String base = scheme.toLowerCase() + "://" + parsed.getRawAuthority() + path;

        Map<String, String> params = new LinkedHashMap<>();
        String sid = null;
        String query = parsed.getRawQuery();
        if (query != null && !query.isEmpty())
        {
            for (String pair : query.split("&"))
            {
                if (pair.isEmpty())
                {
                    continue;
                }
                int eq = pair.indexOf('=');
                String key = decode(eq < 0 ? pair : pair.substring(0, eq));
                String value = eq < 0 ? "" : decode(pair.substring(eq + 1));
                if (SESSION_PARAM.equals(key))
                {
                    sid = value.isBlank() ? null : value.trim();
                }
                else
                {
                    params.put(key, value);
                }
            }
        }

        return new ConnectionAddress(base, params, sid);
    }

    /**
     * Returns the session id carried by the configured URI.
     *
     * @return the session id, or empty
     */
    public Optional<String> sessionId()
    {
        return Optional.ofNullable(sessionId);
    }

    /**
     * Returns the forwarded query parameters, in their original order.
     *
     * @return forwarded parameters
     */
    public Map<String, String> queryParams()
    {
        return queryParams;
    }

    /**
     * Builds the URI for the next connection.
     *
     * @param sessionId the session to resume, or null
     * @param everReady whether the session has been ready at least once
     * @return the connection URI
     */
    public URI resolve(String sessionId, boolean everReady)
    {
        StringBuilder query = new StringBuilder();
        if (sessionId != null)
        {
            appendParam(query, SESSION_PARAM, sessionId);
        }
        for (Map.Entry<String, String> entry : queryParams.entrySet())
        {
            if (everReady && INITIAL_ONLY_PARAMS.contains(entry.getKey()))
            {
                continue;
            }
            appendParam(query, entry.getKey(), entry.getValue());
        }

        String uri = query.length() == 0 ? baseUri : baseUri + "?" + query;
        return URI.create(uri);
    }

    @Override
    public String toString()
    {
        return baseUri;
    }

    private static void appendParam(StringBuilder query, String key, String value)
    {
        if (query.length() > 0)
        {
            query.append('&');
        }
        query.append(URLEncoder.encode(key, StandardCharsets.UTF_8))
                .append('=')
                .append(URLEncoder.encode(value, StandardCharsets.UTF_8));
    }

    private static String decode(String s)
    {
        return URLDecoder.decode(s, StandardCharsets.UTF_8);
    }
}
