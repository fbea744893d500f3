package warden.core.service.session;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.model.session.SessionRecord;
import warden.core.port.out.SessionRepository;

/**
 * Authoritative token to principal mapping for session strategies.
 *
 * <p>Each registry owns one {@link SessionRepository}. Concurrency is delegated to the
 * repository's atomic operations; the registry itself holds no lock, so nothing is
 * held across a credential store call made with its results.
 *
 * <p>Expiry is lazy: a record past {@code createdAt + duration} resolves to empty but
 * stays stored until it is destroyed or swept by the repository.
 */
public class SessionRegistry {

    private static final Logger LOG = Logger.getLogger(SessionRegistry.class);

    private final SessionRepository repository;
    private final SessionIdGenerator idGenerator;
    private final Duration sessionDuration;
    private final Clock clock;
    private final Duration storageTimeout;
    private final int maxRetries;

    /**
     * @param repository      backing storage
     * @param idGenerator     token source
     * @param sessionDuration lifetime of new sessions, zero or negative for no expiry
     * @param clock           time source for creation and expiry checks
     * @param storageTimeout  upper bound on a single storage call
     * @param maxRetries      attempts to store a session under a fresh token
     */
    public SessionRegistry(
            SessionRepository repository,
            SessionIdGenerator idGenerator,
            Duration sessionDuration,
            Clock clock,
            Duration storageTimeout,
            int maxRetries) {
        this.repository = repository;
        this.idGenerator = idGenerator;
        this.sessionDuration = sessionDuration != null ? sessionDuration : Duration.ZERO;
        this.clock = clock;
        this.storageTimeout = storageTimeout;
        this.maxRetries = Math.max(1, maxRetries);
    }

    /**
     * Create a session for a principal.
     *
     * @param principalId principal to bind
     * @return the new token, or empty if the principal id is null or blank
     * @throws SessionCreationException if storage fails or no free token is found within the retry budget
     */
    public Optional<String> create(String principalId) {
        if (principalId == null || principalId.isBlank()) {
            return Optional.empty();
        }

        Instant now = clock.instant();
        for (int attempt = 0; attempt < maxRetries; attempt++) {
            String token = idGenerator.generate();
            SessionRecord record = new SessionRecord(token, principalId, now, sessionDuration);

            boolean saved;
            try {
                saved = await(repository.saveIfAbsent(record));
            } catch (RuntimeException e) {
                throw new SessionCreationException("Failed to store session for principal " + principalId, e);
            }

            if (saved) {
                LOG.debugf("Session %s created for principal %s", SessionIdGenerator.mask(token), principalId);
                return Optional.of(token);
            }
            LOG.warnf("Session token collision detected (attempt %d/%d), retrying", attempt + 1, maxRetries);
        }

        throw new SessionCreationException("Failed to generate unique session token after " + maxRetries + " attempts");
    }

    /**
     * Resolve a token to its principal id.
     *
     * @return empty if the token is null, malformed, unknown, expired, or storage fails
     */
    public Optional<String> resolve(String token) {
        return findLive(token).map(SessionRecord::principalId);
    }

    /**
     * Return the live record for a token.
     */
    public Optional<SessionRecord> findLive(String token) {
        if (!idGenerator.isWellFormed(token)) {
            return Optional.empty();
        }

        Optional<SessionRecord> record;
        try {
            record = await(repository.findByToken(token));
        } catch (RuntimeException e) {
            LOG.warnf("Session lookup failed for %s: %s", SessionIdGenerator.mask(token), e.getMessage());
            return Optional.empty();
        }

        if (record.isEmpty()) {
            return Optional.empty();
        }
        if (record.get().isExpiredAt(clock.instant())) {
            LOG.debugf("Session %s has expired", SessionIdGenerator.mask(token));
            return Optional.empty();
        }
        return record;
    }

    /**
     * Remove a session. Idempotent.
     *
     * @return true if a session existed for the token
     */
    public boolean destroy(String token) {
        if (!idGenerator.isWellFormed(token)) {
            return false;
        }

        try {
            boolean removed = await(repository.delete(token));
            if (removed) {
                LOG.debugf("Session %s destroyed", SessionIdGenerator.mask(token));
            }
            return removed;
        } catch (RuntimeException e) {
            LOG.warnf("Session removal failed for %s: %s", SessionIdGenerator.mask(token), e.getMessage());
            return false;
        }
    }

    public Duration sessionDuration() {
        return sessionDuration;
    }

    private <T> T await(Uni<T> operation) {
        return operation.await().atMost(storageTimeout);
    }
}
