package warden.adapter.in.auth;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import warden.core.model.auth.AuthType;
import warden.core.model.auth.InboundRequest;
import warden.core.model.auth.Principal;
import warden.core.model.auth.PrincipalAttribute;
import warden.core.port.out.CredentialStore;
import warden.core.service.auth.AuthStrategySupport;
import warden.core.service.session.SessionRegistry;
import warden.spi.SessionStrategy;

/**
 * Cookie-carried server-side session strategy.
 *
 * <p>Backs {@code session_auth}, {@code session_exp_auth} and {@code session_db_auth}.
 * The variants differ only in the {@link SessionRegistry} they are given: its
 * session duration and its repository.
 */
public class SessionAuthStrategy implements SessionStrategy {

    private final AuthType type;
    private final AuthStrategySupport support;
    private final CredentialStore credentialStore;
    private final SessionRegistry sessionRegistry;

    public SessionAuthStrategy(
            AuthType type,
            AuthStrategySupport support,
            CredentialStore credentialStore,
            SessionRegistry sessionRegistry) {
        if (!type.usesSessions()) {
            throw new IllegalArgumentException(type.value() + " is not a session strategy");
        }
        this.type = type;
        this.support = support;
        this.credentialStore = credentialStore;
        this.sessionRegistry = sessionRegistry;
    }

    @Override
    public AuthType type() {
        return type;
    }

    @Override
    public boolean requireAuth(String path, List<String> excludedPaths) {
        return support.requireAuth(path, excludedPaths);
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
        return sessionCookie(request)
                .flatMap(this::userIdForSessionId)
                .flatMap(id -> credentialStore.findUnique(PrincipalAttribute.ID, id).principal());
    }

    @Override
    public Optional<String> createSession(String principalId) {
        return sessionRegistry.create(principalId);
    }

    @Override
    public Optional<String> userIdForSessionId(String token) {
        return sessionRegistry.resolve(token);
    }

    @Override
    public boolean destroySession(InboundRequest request) {
        return sessionCookie(request).map(sessionRegistry::destroy).orElse(false);
    }

    @Override
    public Duration sessionDuration() {
        return sessionRegistry.sessionDuration();
    }

    public Optional<String> sessionCookieName() {
        return support.sessionCookieName();
    }

    public SessionRegistry sessionRegistry() {
        return sessionRegistry;
    }
}
