package warden.core.port.out;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import warden.core.model.session.SessionRecord;

/**
 * Outbound port for session storage operations.
 *
 * <p>Implementations may keep sessions in memory or persist them in a durable
 * store. Expiry is not enforced here: repositories return records as stored and
 * the session registry decides whether they are still valid.
 */
public interface SessionRepository {

    /**
     * Store a new session only if the token does not already exist.
     *
     * <p>Implementation notes:
     * <ul>
     *   <li>Redis: SET with the NX flag</li>
     *   <li>In-Memory: ConcurrentHashMap.putIfAbsent()</li>
     * </ul>
     *
     * @param record session to store
     * @return true if saved, false if the token is already taken
     */
    Uni<Boolean> saveIfAbsent(SessionRecord record);

    /**
     * Retrieve a session by token.
     *
     * @param token session token
     * @return the stored record, or empty if not found
     */
    Uni<Optional<SessionRecord>> findByToken(String token);

    /**
     * Delete a session.
     *
     * @param token session token
     * @return true if a record existed and was removed
     */
    Uni<Boolean> delete(String token);
}
