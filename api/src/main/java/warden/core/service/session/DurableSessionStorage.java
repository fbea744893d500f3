package warden.core.service.session;

import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import warden.config.SessionConfig;
import warden.core.port.out.SessionRepository;
import warden.spi.SessionStorageProvider;

/**
 * Resolves the durable session store behind {@code session_db_auth}.
 *
 * <p>The provider named by {@code warden.session.storage.provider} is used as is.
 * An unknown name, a process-local provider or an unreachable backend is a
 * configuration error: persisted sessions are never silently kept in memory.
 *
 * <p>Resolution happens on first use, so strategies that keep sessions in memory
 * never contact the durable backend.
 */
@ApplicationScoped
public class DurableSessionStorage {

    private static final Logger LOG = Logger.getLogger(DurableSessionStorage.class);

    private final Instance<SessionStorageProvider> providers;
    private final SessionConfig config;

    private SessionStorageProvider provider;
    private SessionRepository repository;

    @Inject
    public DurableSessionStorage(Instance<SessionStorageProvider> providers, SessionConfig config) {
        this.providers = providers;
        this.config = config;
    }

    /**
     * Return the repository of the durable store, resolving the provider on first call.
     *
     * @throws IllegalStateException if the configured provider is unknown, not durable, or unreachable
     */
    public synchronized SessionRepository repository() {
        if (repository == null) {
            repository = provider().createRepository();
        }
        return repository;
    }

    /**
     * Return the configured durable provider.
     *
     * @throws IllegalStateException if the configured provider is unknown, not durable, or unreachable
     */
    public synchronized SessionStorageProvider provider() {
        if (provider == null) {
            provider = resolve(config.storage().provider());
        }
        return provider;
    }

    private SessionStorageProvider resolve(String name) {
        List<SessionStorageProvider> candidates = providers.stream().toList();
        SessionStorageProvider configured = candidates.stream()
                .filter(candidate -> candidate.name().equals(name))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("Unknown session storage provider '" + name
                        + "', known providers: "
                        + candidates.stream().map(SessionStorageProvider::name).toList()));

        if (!configured.durable()) {
            throw new IllegalStateException("Session storage provider '" + name
                    + "' does not persist sessions across restarts and cannot back session_db_auth");
        }
        if (!configured.isAvailable()) {
            throw new IllegalStateException("Session storage provider '" + name + "' is not reachable");
        }

        LOG.infof("Persisting sessions in %s", name);
        return configured;
    }
}
