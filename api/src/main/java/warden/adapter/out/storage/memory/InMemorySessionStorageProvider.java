package warden.adapter.out.storage.memory;

import java.time.Clock;
import java.util.Optional;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheckResponse;
import org.jboss.logging.Logger;

import warden.config.SessionConfig;
import warden.core.port.out.SessionRepository;
import warden.spi.SessionStorageProvider;

/**
 * In-memory session storage provider.
 *
 * <p>Backs {@code session_auth} and {@code session_exp_auth}. Not durable, so
 * {@code session_db_auth} refuses it.
 */
@ApplicationScoped
public class InMemorySessionStorageProvider implements SessionStorageProvider {

    private static final Logger LOG = Logger.getLogger(InMemorySessionStorageProvider.class);

    private final SessionConfig config;
    private final Clock clock;

    private InMemorySessionRepository repository;

    @Inject
    public InMemorySessionStorageProvider(SessionConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public boolean durable() {
        return false;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public synchronized SessionRepository createRepository() {
        if (repository == null) {
            repository = new InMemorySessionRepository(config.sweepInterval(), clock);
            LOG.info("Created in-memory session repository; sessions do not survive a restart");
        }
        return repository;
    }

    @Override
    public synchronized Optional<HealthCheckResponse> healthCheck() {
        return Optional.of(HealthCheckResponse.named("session-storage-memory")
                .up()
                .withData("store", "memory")
                .withData("sessions", repository != null ? repository.getSessionCount() : 0)
                .build());
    }

    @PreDestroy
    synchronized void shutdown() {
        if (repository != null) {
            repository.shutdown();
        }
    }
}
