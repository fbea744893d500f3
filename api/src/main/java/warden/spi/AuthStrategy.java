package warden.spi;

import java.util.List;
import java.util.Optional;

import warden.core.model.auth.AuthType;
import warden.core.model.auth.InboundRequest;
import warden.core.model.auth.Principal;

/**
 * Service Provider Interface for request authentication strategies.
 *
 * <p>Exactly one strategy is active per deployment, selected through
 * {@code warden.auth.type}. Built-in strategies:
 * <ul>
 *   <li><b>none</b>: no request requires authentication</li>
 *   <li><b>basic_auth</b>: HTTP Basic credentials checked against the credential store</li>
 *   <li><b>session_auth</b>, <b>session_exp_auth</b>, <b>session_db_auth</b>: opaque
 *       server-side sessions carried in a cookie, see {@link SessionStrategy}</li>
 * </ul>
 *
 * <p>Every method is total: malformed or unknown credentials yield an empty result,
 * never an exception.
 */
public interface AuthStrategy {

    /**
     * The strategy type, used for logging and selection.
     */
    AuthType type();

    /**
     * Decide whether a path requires authentication.
     *
     * @param path          request path
     * @param excludedPaths exact or {@code *}-suffixed prefix patterns exempt from authentication
     * @return false if the path is excluded
     */
    boolean requireAuth(String path, List<String> excludedPaths);

    /**
     * Return the raw {@code Authorization} header value.
     */
    Optional<String> authorizationHeader(InboundRequest request);

    /**
     * Return the session token carried in the configured session cookie.
     */
    Optional<String> sessionCookie(InboundRequest request);

    /**
     * Resolve the caller's identity.
     *
     * @return the principal, or empty if the request is unauthenticated
     */
    Optional<Principal> currentPrincipal(InboundRequest request);
}
