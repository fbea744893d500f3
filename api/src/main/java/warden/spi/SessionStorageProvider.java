package warden.spi;

import java.util.Optional;

import org.eclipse.microprofile.health.HealthCheckResponse;

import warden.core.port.out.SessionRepository;

/**
 * SPI for session storage backends.
 *
 * <p>Built-in providers:
 * <ul>
 *   <li>redis: durable, backs {@code session_db_auth}</li>
 *   <li>memory: process-local, backs {@code session_auth} and {@code session_exp_auth}</li>
 * </ul>
 *
 * <p>{@code session_db_auth} only accepts the provider named by
 * {@code warden.session.storage.provider}, and only if it is durable and reachable.
 */
public interface SessionStorageProvider {

    /**
     * Return the name matched against {@code warden.session.storage.provider}.
     */
    String name();

    /**
     * Whether stored sessions survive a restart of this process and can be read by
     * other processes.
     */
    boolean durable();

    /**
     * Check that the backend can serve requests now.
     *
     * <p>May block for up to the configured storage timeout.
     */
    boolean isAvailable();

    /**
     * Return the session repository, creating it on first use.
     */
    SessionRepository createRepository();

    /**
     * Report the health of this storage backend.
     *
     * @return health response, or empty if not supported
     */
    Optional<HealthCheckResponse> healthCheck();
}
