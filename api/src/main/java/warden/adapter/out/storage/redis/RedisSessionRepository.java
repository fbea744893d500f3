package warden.adapter.out.storage.redis;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.model.session.SessionRecord;
import warden.core.port.out.SessionRepository;
import warden.core.service.session.SessionIdGenerator;

/**
 * Redis implementation of SessionRepository.
 *
 * <p>Each session is one string key, {@code <prefix><token>}, holding
 * {@code token|principalId|createdAtMillis|durationMillis}. Keys carry no TTL:
 * expired sessions stay visible to operators until they are destroyed, and the
 * session registry rejects them on read. Uses SETNX semantics for atomic
 * insert-if-absent to prevent token collisions.
 */
public class RedisSessionRepository implements SessionRepository {

    private static final Logger LOG = Logger.getLogger(RedisSessionRepository.class);
    private static final String SEPARATOR = "|";

    private final ReactiveValueCommands<String, String> valueCommands;
    private final ReactiveKeyCommands<String> keyCommands;
    private final String keyPrefix;
    private final RedisTimeoutHelper timeoutHelper;

    public RedisSessionRepository(
            ReactiveRedisDataSource redisDataSource, String keyPrefix, RedisTimeoutHelper timeoutHelper) {
        this.valueCommands = redisDataSource.value(String.class, String.class);
        this.keyCommands = redisDataSource.key(String.class);
        this.keyPrefix = keyPrefix;
        this.timeoutHelper = timeoutHelper;
    }

    @Override
    public Uni<Boolean> saveIfAbsent(SessionRecord record) {
        String key = keyPrefix + record.token();

        var operation = valueCommands
                .setnx(key, serialize(record))
                .map(saved -> {
                    if (Boolean.TRUE.equals(saved)) {
                        LOG.debugf("Session stored in Redis: %s", SessionIdGenerator.mask(record.token()));
                        return true;
                    }
                    LOG.debugf("Session token collision in Redis: %s", SessionIdGenerator.mask(record.token()));
                    return false;
                });
        return timeoutHelper.withTimeout(operation, "saveIfAbsent");
    }

    @Override
    public Uni<Optional<SessionRecord>> findByToken(String token) {
        String key = keyPrefix + token;

        var operation = valueCommands.get(key).map(value -> {
            if (value == null) {
                return Optional.<SessionRecord>empty();
            }
            return Optional.of(deserialize(value));
        });
        return timeoutHelper.withTimeout(operation, "findByToken");
    }

    @Override
    public Uni<Boolean> delete(String token) {
        String key = keyPrefix + token;

        var operation = keyCommands.del(key).map(removed -> removed != null && removed > 0);
        return timeoutHelper.withTimeout(operation, "delete");
    }

    static String serialize(SessionRecord record) {
        // Simple pipe-separated format for efficiency
        return record.token() + SEPARATOR
                + record.principalId() + SEPARATOR
                + record.createdAt().toEpochMilli() + SEPARATOR
                + record.duration().toMillis();
    }

    static SessionRecord deserialize(String value) {
        String[] parts = value.split("\\|", -1);
        if (parts.length < 4) {
            throw new IllegalArgumentException("Invalid session format");
        }

        return new SessionRecord(
                parts[0],
                parts[1],
                Instant.ofEpochMilli(Long.parseLong(parts[2])),
                parts[3].isEmpty() ? Duration.ZERO : Duration.ofMillis(Long.parseLong(parts[3])));
    }
}
