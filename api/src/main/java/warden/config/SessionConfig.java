package warden.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for session management.
 *
 * <p>Configuration prefix: {@code warden.session}
 */
@ConfigMapping(prefix = "warden.session")
public interface SessionConfig {

    /**
     * Cookie configuration.
     */
    CookieConfig cookie();

    /**
     * Session lifetime for {@code session_exp_auth} and {@code session_db_auth}.
     *
     * <p>Zero or negative means sessions never expire.
     *
     * @return Session duration (default: never expires)
     */
    @WithDefault("PT0S")
    Duration duration();

    /**
     * Interval of the background sweep removing expired in-memory sessions.
     *
     * <p>When unset, expired sessions are only rejected on read and stay stored
     * until they are destroyed.
     *
     * @return sweep interval (optional)
     */
    Optional<Duration> sweepInterval();

    /**
     * ID generation configuration.
     */
    IdGenerationConfig idGeneration();

    /**
     * Storage configuration.
     */
    StorageConfig storage();

    /**
     * Cookie configuration options.
     */
    interface CookieConfig {

        /**
         * Session cookie name.
         *
         * <p>If not set, no session cookie is ever found on requests.
         *
         * @return Cookie name (optional)
         */
        Optional<String> name();

        /**
         * @return Cookie path (default: /)
         */
        @WithDefault("/")
        String path();

        /**
         * Mark cookie as secure (HTTPS only).
         *
         * @return true if secure (default: true)
         */
        @WithDefault("true")
        boolean secure();

        /**
         * Mark cookie as HttpOnly (not accessible via JavaScript).
         *
         * @return true if HttpOnly (default: true)
         */
        @WithDefault("true")
        boolean httpOnly();

        /**
         * SameSite attribute.
         *
         * @return SameSite value: Strict, Lax, or None (default: Lax)
         */
        @WithDefault("Lax")
        String sameSite();
    }

    /**
     * Session token generation configuration.
     */
    interface IdGenerationConfig {

        /**
         * Maximum attempts to store a session under a fresh token when the
         * generated token is already taken.
         *
         * @return Max attempts (default: 3)
         */
        @WithDefault("3")
        int maxRetries();
    }

    /**
     * Storage configuration options.
     */
    interface StorageConfig {

        /**
         * Storage provider for persisted sessions ({@code session_db_auth}).
         *
         * <p>Must name a durable provider: redis, or a custom SPI name. There is no
         * fallback when it is unreachable.
         *
         * @return Provider name (default: redis)
         */
        @WithDefault("redis")
        String provider();

        /**
         * Upper bound on a single storage call.
         *
         * @return timeout (default: 2 seconds)
         */
        @WithDefault("PT2S")
        Duration timeout();

        /**
         * Redis-specific configuration.
         */
        RedisConfig redis();

        /**
         * Redis storage configuration.
         */
        interface RedisConfig {

            /**
             * Key prefix for session data in Redis.
             *
             * @return Key prefix (default: warden:session:)
             */
            @WithDefault("warden:session:")
            String keyPrefix();
        }
    }
}
