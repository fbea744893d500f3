package warden.core.model.session;

import java.time.Duration;
import java.time.Instant;

/**
 * Server-side session mapping an opaque token to a principal.
 *
 * <p>A record with a null, zero or negative {@code duration} never expires.
 * Expiry is evaluated lazily by readers; expired records stay stored until
 * they are destroyed or swept.
 *
 * @param token       opaque session token (canonical textual UUID)
 * @param principalId identifier of the principal the session belongs to
 * @param createdAt   creation timestamp
 * @param duration    session lifetime, non-positive for no expiry
 */
public record SessionRecord(String token, String principalId, Instant createdAt, Duration duration) {

    public SessionRecord {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("Session token cannot be null or blank");
        }
        if (principalId == null || principalId.isBlank()) {
            throw new IllegalArgumentException("Principal id cannot be null or blank");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("Creation time cannot be null");
        }
        if (duration == null) {
            duration = Duration.ZERO;
        }
    }

    /**
     * Whether this record carries an expiry.
     */
    public boolean expires() {
        return !duration.isNegative() && !duration.isZero();
    }

    /**
     * Return the instant after which the session is no longer valid, or null if it never expires.
     */
    public Instant expiresAt() {
        return expires() ? createdAt.plus(duration) : null;
    }

    /**
     * Checks if the session has expired at the given instant.
     *
     * <p>The session is still valid at exactly {@code createdAt + duration}.
     */
    public boolean isExpiredAt(Instant now) {
        return expires() && now.isAfter(expiresAt());
    }
}
