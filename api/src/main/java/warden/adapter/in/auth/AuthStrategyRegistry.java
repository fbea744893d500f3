package warden.adapter.in.auth;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import io.quarkus.runtime.StartupEvent;
import org.jboss.logging.Logger;

import warden.adapter.out.storage.memory.InMemorySessionStorageProvider;
import warden.config.AuthConfig;
import warden.config.SessionConfig;
import warden.core.model.auth.AuthType;
import warden.core.port.out.CredentialStore;
import warden.core.port.out.SessionRepository;
import warden.core.service.auth.AuthStrategySupport;
import warden.core.service.session.DurableSessionStorage;
import warden.core.service.session.SessionIdGenerator;
import warden.core.service.session.SessionRegistry;
import warden.spi.AuthStrategy;
import warden.spi.SessionStrategy;

/**
 * Builds the single active authentication strategy from configuration.
 *
 * <p>Mapping of {@code warden.auth.type}:
 * <ul>
 *   <li>unset: no strategy, every request is allowed</li>
 *   <li>{@code none}: {@link NullAuthStrategy}</li>
 *   <li>{@code basic_auth}: {@link BasicAuthStrategy}</li>
 *   <li>{@code session_auth}: in-memory sessions that never expire</li>
 *   <li>{@code session_exp_auth}: in-memory sessions expiring after {@code warden.session.duration}</li>
 *   <li>{@code session_db_auth}: sessions in the durable store named by
 *       {@code warden.session.storage.provider}, expiring likewise; startup fails if it is unusable</li>
 * </ul>
 *
 * <p>The strategy is built at startup so that an unknown type or an unusable durable
 * store fails fast.
 */
@ApplicationScoped
public class AuthStrategyRegistry {

    private static final Logger LOG = Logger.getLogger(AuthStrategyRegistry.class);

    private final AuthConfig authConfig;
    private final SessionConfig sessionConfig;
    private final CredentialStore credentialStore;
    private final SessionIdGenerator idGenerator;
    private final InMemorySessionStorageProvider memoryProvider;
    private final DurableSessionStorage durableStorage;
    private final Clock clock;

    private Optional<AuthStrategy> active;

    @Inject
    public AuthStrategyRegistry(
            AuthConfig authConfig,
            SessionConfig sessionConfig,
            CredentialStore credentialStore,
            SessionIdGenerator idGenerator,
            InMemorySessionStorageProvider memoryProvider,
            DurableSessionStorage durableStorage,
            Clock clock) {
        this.authConfig = authConfig;
        this.sessionConfig = sessionConfig;
        this.credentialStore = credentialStore;
        this.idGenerator = idGenerator;
        this.memoryProvider = memoryProvider;
        this.durableStorage = durableStorage;
        this.clock = clock;
    }

    void onStart(@Observes StartupEvent event) {
        active();
    }

    /**
     * Return the configured strategy, building it on first call.
     *
     * @throws IllegalArgumentException if {@code warden.auth.type} names no known strategy
     */
    public synchronized Optional<AuthStrategy> active() {
        if (active == null) {
            active = authConfig.type()
                    .filter(value -> !value.isBlank())
                    .map(value -> build(AuthType.fromValue(value.trim())));
            if (active.isPresent()) {
                LOG.infof("Authentication strategy: %s", active.get().type().value());
            } else {
                LOG.info("No authentication strategy configured, all requests are allowed");
            }
        }
        return active;
    }

    /**
     * Return the active strategy if it issues sessions.
     */
    public Optional<SessionStrategy> sessionStrategy() {
        return active()
                .filter(SessionStrategy.class::isInstance)
                .map(SessionStrategy.class::cast);
    }

    private AuthStrategy build(AuthType type) {
        AuthStrategySupport support = new AuthStrategySupport(sessionConfig.cookie().name());
        return switch (type) {
            case NONE -> new NullAuthStrategy(support);
            case BASIC -> new BasicAuthStrategy(support, credentialStore);
            case SESSION -> new SessionAuthStrategy(
                    type, support, credentialStore, sessionRegistry(memoryProvider.createRepository(), Duration.ZERO));
            case SESSION_EXP -> new SessionAuthStrategy(
                    type,
                    support,
                    credentialStore,
                    sessionRegistry(memoryProvider.createRepository(), sessionConfig.duration()));
            case SESSION_DB -> new SessionAuthStrategy(
                    type,
                    support,
                    credentialStore,
                    sessionRegistry(durableStorage.repository(), sessionConfig.duration()));
        };
    }

    private SessionRegistry sessionRegistry(SessionRepository repository, Duration duration) {
        if (sessionConfig.cookie().name().filter(name -> !name.isBlank()).isEmpty()) {
            LOG.warn("warden.session.cookie.name is not set, session cookies will never be found");
        }
        return new SessionRegistry(
                repository,
                idGenerator,
                duration,
                clock,
                sessionConfig.storage().timeout(),
                sessionConfig.idGeneration().maxRetries());
    }
}
