package warden.core.service.auth;

import java.util.List;
import java.util.Optional;

import warden.core.model.auth.InboundRequest;

/**
 * Request inspection shared by every authentication strategy.
 *
 * <p>Strategies hold an instance and delegate path exclusion, header and cookie
 * extraction to it, overriding only principal resolution and session handling.
 */
public final class AuthStrategySupport {

    private static final String SEPARATOR = "/";
    private static final String WILDCARD = "*";

    private final Optional<String> sessionCookieName;

    /**
     * @param sessionCookieName name of the session cookie; when empty no cookie is ever found
     */
    public AuthStrategySupport(Optional<String> sessionCookieName) {
        this.sessionCookieName = sessionCookieName.filter(name -> !name.isBlank());
    }

    /**
     * Support without a session cookie.
     */
    public static AuthStrategySupport withoutCookie() {
        return new AuthStrategySupport(Optional.empty());
    }

    /**
     * Decide whether a path requires authentication.
     *
     * <p>The path and every entry are normalized to end with exactly one {@code /}.
     * An entry ending in {@code *} matches paths starting with its normalized prefix,
     * so {@code /api/v1/stat*} matches {@code /api/v1/stat/x} but not {@code /api/v1/status}.
     * Other entries must match exactly. Matching is case-sensitive.
     *
     * @return true when the path is null or empty, the list is null or empty, or no entry matches
     */
    public boolean requireAuth(String path, List<String> excludedPaths) {
        if (path == null || path.isEmpty() || excludedPaths == null || excludedPaths.isEmpty()) {
            return true;
        }

        String normalizedPath = normalize(path);
        for (String excluded : excludedPaths) {
            if (excluded == null || excluded.isEmpty()) {
                continue;
            }
            if (excluded.endsWith(WILDCARD)) {
                String prefix = normalize(excluded.substring(0, excluded.length() - WILDCARD.length()));
                if (normalizedPath.startsWith(prefix)) {
                    return false;
                }
            } else if (normalizedPath.equals(normalize(excluded))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Return the raw {@code Authorization} header.
     */
    public Optional<String> authorizationHeader(InboundRequest request) {
        if (request == null) {
            return Optional.empty();
        }
        return request.header(InboundRequest.AUTHORIZATION);
    }

    /**
     * Return the value of the configured session cookie, ignoring blank values.
     */
    public Optional<String> sessionCookie(InboundRequest request) {
        if (request == null || sessionCookieName.isEmpty()) {
            return Optional.empty();
        }
        return request.cookie(sessionCookieName.get()).filter(value -> !value.isBlank());
    }

    /**
     * Return the configured session cookie name.
     */
    public Optional<String> sessionCookieName() {
        return sessionCookieName;
    }

    static String normalize(String path) {
        int end = path.length();
        while (end > 0 && path.charAt(end - 1) == '/') {
            end--;
        }
        return path.substring(0, end) + SEPARATOR;
    }
}
