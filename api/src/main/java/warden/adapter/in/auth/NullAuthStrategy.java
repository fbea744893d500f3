package warden.adapter.in.auth;

import java.util.List;
import java.util.Optional;

import warden.core.model.auth.AuthType;
import warden.core.model.auth.InboundRequest;
import warden.core.model.auth.Principal;
import warden.core.service.auth.AuthStrategySupport;
import warden.spi.AuthStrategy;

/**
 * Strategy for {@code warden.auth.type=none}.
 *
 * <p>No path requires authentication and no request ever carries a principal.
 */
public class NullAuthStrategy implements AuthStrategy {

    private final AuthStrategySupport support;

    public NullAuthStrategy(AuthStrategySupport support) {
        this.support = support;
    }

    @Override
    public AuthType type() {
        return AuthType.NONE;
    }

    @Override
    public boolean requireAuth(String path, List<String> excludedPaths) {
        return false;
    }

    @Override
    public Optional<String> authorizationHeader(InboundRequest request) {
        return support.authorizationHeader(request);
    }

    @Override
    public Optional<String> sessionCookie(InboundRequest request) {
        return support.sessionCookie(request);
    }

    @Override
    public Optional<Principal> currentPrincipal(InboundRequest request) {
        return Optional.empty();
    }
}
