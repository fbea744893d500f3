package warden.core.service.auth;

import java.util.List;
import java.util.Optional;

import org.jboss.logging.Logger;

import warden.core.model.auth.AuthDecision;
import warden.core.model.auth.InboundRequest;
import warden.core.model.auth.Principal;
import warden.spi.AuthStrategy;

/**
 * Single entry point deciding, once per inbound request, whether it may proceed.
 *
 * <p>Decision order:
 * <ol>
 *   <li>No strategy configured: allow</li>
 *   <li>Path excluded from authentication: allow</li>
 *   <li>Neither an {@code Authorization} header nor a session cookie: Unauthorized</li>
 *   <li>No principal resolved, including credential store failures: Forbidden</li>
 *   <li>Otherwise allow with the resolved principal</li>
 * </ol>
 *
 * <p>Never throws; constructed once at startup and shared by all request threads.
 */
public class RequestGate {

    private static final Logger LOG = Logger.getLogger(RequestGate.class);

    private final Optional<AuthStrategy> strategy;
    private final List<String> excludedPaths;

    public RequestGate(Optional<AuthStrategy> strategy, List<String> excludedPaths) {
        this.strategy = strategy;
        this.excludedPaths = excludedPaths != null ? List.copyOf(excludedPaths) : List.of();
    }

    public AuthDecision evaluate(InboundRequest request) {
        if (strategy.isEmpty()) {
            return AuthDecision.Allow.anonymous();
        }

        AuthStrategy auth = strategy.get();
        if (!auth.requireAuth(request.path(), excludedPaths)) {
            LOG.tracef("Path %s excluded from authentication", request.path());
            return AuthDecision.Allow.anonymous();
        }

        if (auth.authorizationHeader(request).isEmpty()
                && auth.sessionCookie(request).isEmpty()) {
            LOG.debugf("No credentials presented for %s", request.path());
            return AuthDecision.Unauthorized.instance();
        }

        Optional<Principal> principal = resolve(auth, request);
        if (principal.isEmpty()) {
            LOG.debugf("Credentials presented for %s did not resolve to a principal", request.path());
            return AuthDecision.Forbidden.instance();
        }

        LOG.debugf("Authenticated principal %s via %s", principal.get().id(), auth.type().value());
        return AuthDecision.Allow.as(principal.get());
    }

    public Optional<AuthStrategy> strategy() {
        return strategy;
    }

    public List<String> excludedPaths() {
        return excludedPaths;
    }

    private Optional<Principal> resolve(AuthStrategy auth, InboundRequest request) {
        try {
            Optional<Principal> principal = auth.currentPrincipal(request);
            return principal != null ? principal : Optional.empty();
        } catch (RuntimeException e) {
            LOG.warnf(e, "Principal resolution failed for %s", request.path());
            return Optional.empty();
        }
    }
}
