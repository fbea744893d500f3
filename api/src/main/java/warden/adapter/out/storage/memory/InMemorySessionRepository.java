package warden.adapter.out.storage.memory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.model.session.SessionRecord;
import warden.core.port.out.SessionRepository;
import warden.core.service.session.SessionIdGenerator;

/**
 * In-memory implementation of SessionRepository.
 *
 * <p>Sessions are lost on restart and not shared across instances.
 *
 * <p>Expired records are kept until they are deleted, unless a sweep interval is
 * given, in which case a daemon thread removes them periodically.
 */
public class InMemorySessionRepository implements SessionRepository {

    private static final Logger LOG = Logger.getLogger(InMemorySessionRepository.class);

    private final ConcurrentMap<String, SessionRecord> sessions = new ConcurrentHashMap<>();
    private final Clock clock;
    private final ScheduledExecutorService cleanupExecutor;

    public InMemorySessionRepository() {
        this(Optional.empty(), Clock.systemUTC());
    }

    public InMemorySessionRepository(Optional<Duration> sweepInterval, Clock clock) {
        this.clock = clock;
        this.cleanupExecutor = sweepInterval
                .filter(interval -> !interval.isNegative() && !interval.isZero())
                .map(this::startCleanup)
                .orElse(null);
    }

    private ScheduledExecutorService startCleanup(Duration interval) {
        ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "session-cleanup");
            t.setDaemon(true);
            return t;
        });
        long millis = interval.toMillis();
        executor.scheduleAtFixedRate(this::cleanupExpiredSessions, millis, millis, TimeUnit.MILLISECONDS);
        LOG.debugf("Expired session sweep scheduled every %s", interval);
        return executor;
    }

    @Override
    public Uni<Boolean> saveIfAbsent(SessionRecord record) {
        return Uni.createFrom().item(() -> {
            SessionRecord existing = sessions.putIfAbsent(record.token(), record);
            if (existing == null) {
                return true;
            }
            LOG.debugf("Session token collision detected: %s", SessionIdGenerator.mask(record.token()));
            return false;
        });
    }

    @Override
    public Uni<Optional<SessionRecord>> findByToken(String token) {
        // Expiry is decided by the registry
        return Uni.createFrom().item(() -> Optional.ofNullable(sessions.get(token)));
    }

    @Override
    public Uni<Boolean> delete(String token) {
        return Uni.createFrom().item(() -> sessions.remove(token) != null);
    }

    int cleanupExpiredSessions() {
        Instant now = clock.instant();
        int removed = 0;

        for (var entry : sessions.entrySet()) {
            if (entry.getValue().isExpiredAt(now) && sessions.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }

        if (removed > 0) {
            LOG.debugf("Cleaned up %d expired sessions", removed);
        }
        return removed;
    }

    /**
     * Shuts down the cleanup executor, if one is running.
     */
    public void shutdown() {
        if (cleanupExecutor == null) {
            return;
        }
        cleanupExecutor.shutdown();
        try {
            if (!cleanupExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                cleanupExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            cleanupExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Return the current session count (for testing).
     */
    public int getSessionCount() {
        return sessions.size();
    }
}
