package warden.adapter.out.storage.redis;

import java.time.Duration;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

/**
 * Helper for applying timeouts to Redis operations.
 *
 * <p>Session operations are fail-fast: a timeout surfaces as {@link RedisTimeoutException}
 * and other failures (connection errors, server errors) propagate unchanged. The
 * session registry turns both into an absent session or a creation failure.
 */
public class RedisTimeoutHelper {

    private static final Logger LOG = Logger.getLogger(RedisTimeoutHelper.class);

    private final Duration timeout;
    private final String repositoryName;

    /**
     * @param timeout        the timeout duration for Redis operations
     * @param repositoryName the repository name for logging
     */
    public RedisTimeoutHelper(Duration timeout, String repositoryName) {
        this.timeout = timeout;
        this.repositoryName = repositoryName;
    }

    /**
     * Apply timeout to an operation that should fail on timeout.
     *
     * @param operation     the Redis operation
     * @param operationName name for logging
     * @param <T>           the result type
     * @return a Uni that fails with RedisTimeoutException on timeout; other failures propagate
     */
    public <T> Uni<T> withTimeout(Uni<T> operation, String operationName) {
        return operation.ifNoItem().after(timeout).failWith(() -> {
            LOG.warnv("Redis operation timeout: {0} in {1} after {2}", operationName, repositoryName, timeout);
            return new RedisTimeoutException(operationName, repositoryName);
        });
    }

    public Duration timeout() {
        return timeout;
    }

    /**
     * Exception indicating a Redis operation timeout.
     */
    public static class RedisTimeoutException extends RuntimeException {
        private final String operation;
        private final String repository;

        public RedisTimeoutException(String operation, String repository) {
            super("Redis operation timeout: " + operation + " in " + repository);
            this.operation = operation;
            this.repository = repository;
        }

        /** Returns the name of the operation that timed out. */
        public String getOperation() {
            return operation;
        }

        /** Returns the repository where the timeout occurred. */
        public String getRepository() {
            return repository;
        }
    }
}
