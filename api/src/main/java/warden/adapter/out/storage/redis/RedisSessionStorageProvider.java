package warden.adapter.out.storage.redis;

import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.jboss.logging.Logger;

import warden.config.SessionConfig;
import warden.core.port.out.SessionRepository;
import warden.spi.SessionStorageProvider;

/**
 * Durable session storage in Redis, used by {@code session_db_auth}.
 *
 * <p>Redis is only contacted once {@code session_db_auth} resolves this provider.
 * Reachability is checked with an {@code EXISTS} on a key under the session prefix,
 * bounded by {@code warden.session.storage.timeout}.
 */
@ApplicationScoped
public class RedisSessionStorageProvider implements SessionStorageProvider {

    private static final Logger LOG = Logger.getLogger(RedisSessionStorageProvider.class);
    static final String NAME = "redis";

    private final ReactiveRedisDataSource redisDataSource;
    private final SessionConfig sessionConfig;
    private final RedisTimeoutHelper timeoutHelper;

    private RedisSessionRepository repository;

    @Inject
    public RedisSessionStorageProvider(ReactiveRedisDataSource redisDataSource, SessionConfig sessionConfig) {
        this.redisDataSource = redisDataSource;
        this.sessionConfig = sessionConfig;
        this.timeoutHelper = new RedisTimeoutHelper(sessionConfig.storage().timeout(), "RedisSessionRepository");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean durable() {
        return true;
    }

    @Override
    public boolean isAvailable() {
        return reachabilityError().isEmpty();
    }

    @Override
    public synchronized SessionRepository createRepository() {
        if (repository == null) {
            repository = new RedisSessionRepository(redisDataSource, keyPrefix(), timeoutHelper);
            LOG.infof("Sessions are stored in Redis under %s*", keyPrefix());
        }
        return repository;
    }

    @Override
    public Optional<HealthCheckResponse> healthCheck() {
        Optional<String> error = reachabilityError();
        HealthCheckResponseBuilder builder = HealthCheckResponse.named("session-storage-redis")
                .status(error.isEmpty())
                .withData("store", NAME)
                .withData("keyPrefix", keyPrefix())
                .withData("sessionDuration", sessionConfig.duration().toString())
                .withData("expiry", "on read");
        error.ifPresent(message -> builder.withData("error", message));
        return Optional.of(builder.build());
    }

    private Optional<String> reachabilityError() {
        try {
            timeoutHelper
                    .withTimeout(redisDataSource.key(String.class).exists(keyPrefix() + "reachability"), "reachability")
                    .await()
                    .indefinitely();
            return Optional.empty();
        } catch (RuntimeException e) {
            LOG.warnf("Redis session store at %s* is not reachable: %s", keyPrefix(), e.getMessage());
            return Optional.of(String.valueOf(e.getMessage()));
        }
    }

    private String keyPrefix() {
        return sessionConfig.storage().redis().keyPrefix();
    }
}
