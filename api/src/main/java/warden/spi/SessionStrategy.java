package warden.spi;

import java.time.Duration;
import java.util.Optional;

import warden.core.model.auth.InboundRequest;

/**
 * Authentication strategy backed by server-side sessions.
 */
public interface SessionStrategy extends AuthStrategy {

    /**
     * Issue a new session for a principal.
     *
     * @param principalId principal to bind the session to
     * @return the new session token, or empty if the principal id is null or blank
     */
    Optional<String> createSession(String principalId);

    /**
     * Return the principal id bound to a live session.
     *
     * @return empty if the token is unknown, malformed, or expired
     */
    Optional<String> userIdForSessionId(String token);

    /**
     * Destroy the session referenced by the request's session cookie.
     *
     * @return false if the request carries no session cookie or the session does not exist
     */
    boolean destroySession(InboundRequest request);

    /**
     * Lifetime of sessions issued by this strategy, zero if they never expire.
     */
    Duration sessionDuration();
}
