package org.abstractica.streamclient.impl.session;

import org.abstractica.streamclient.impl.protocol.InboundFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.Objects;
import java.util.Optional;

/**
 * Tracks the identity and readiness of the client's logical session.
 *
 * <p>The session manager is passive: the gateway opens every connection
 * with a hello frame, and the manager only records what that frame says.
 * The session id it holds is used to address the next connection so the
 * gateway can resume the session.</p>
 *
 * <p>Readiness is sticky. Once a hello has been received the session stays
 * ready across reconnections; ready is only announced again when the gateway
 * reports that it had to start a new session.</p>
 *
 * <p>Updated only from the client's event thread. Getters may be called
 * from any thread.</p>
 */
public class SessionManager
{
    private static final Logger LOG = LoggerFactory.getLogger(SessionManager.class);

    private final ConnectionAddress address;

    private volatile String sessionId;
    private volatile boolean lastIsNew;
    private volatile Long readyAtMs;

    /**
     * Creates a session manager.
     *
     * @param address            the gateway address
     * @param configuredSessionId session to resume, or null to use the one in the address
     */
    public SessionManager(ConnectionAddress address, String configuredSessionId)
    {
        this.address = Objects.requireNonNull(address, "address");
        this.sessionId = configuredSessionId != null
                ? configuredSessionId
                : address.sessionId().orElse(null);
    }

    /**
     * Records a hello frame.
     *
     * @param hello the hello frame
     * @param nowMs current time
     * @return true if the session became ready and ready should be announced
     */
    public boolean onHello(InboundFrame.Hello hello, long nowMs)
    {
        Objects.requireNonNull(hello, "hello");

        String previous = sessionId;
        sessionId = hello.sessionId();
        lastIsNew = hello.isNew();

        if (readyAtMs != null && !hello.isNew())
        {
            LOG.debug("Session '{}' resumed", sessionId);
            return false;
        }

        if (readyAtMs != null && previous != null)
        {
            LOG.info("Session '{}' could not be resumed, gateway created session '{}'", previous, sessionId);
        }
        readyAtMs = nowMs;
        return true;
    }

    /**
     * Returns the URI for the next connection attempt.
     *
     * @return the connection URI
     */
    public URI connectionUri()
    {
        return address.resolve(sessionId, isReady());
    }

    public Optional<String> getSessionId()
    {
        return Optional.ofNullable(sessionId);
    }

    /**
     * Returns whether the session has been ready at least once.
     *
     * @return true if ready
     */
    public boolean isReady()
    {
        return readyAtMs != null;
    }

    /**
     * Returns the isNew flag of the most recent hello.
     *
     * @return true if the last hello reported a new session
     */
    public boolean isLastSessionNew()
    {
        return lastIsNew;
    }

    /**
     * Returns when the session last became ready.
     *
     * @return timestamp in milliseconds, or empty if never ready
     */
    public Optional<Long> getReadyAtMs()
    {
        return Optional.ofNullable(readyAtMs);
    }
}
