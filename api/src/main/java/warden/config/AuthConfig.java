package warden.config;

import java.util.List;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for request authentication.
 *
 * <p>Configuration prefix: {@code warden.auth}
 */
@ConfigMapping(prefix = "warden.auth")
public interface AuthConfig {

    /**
     * Active authentication strategy.
     *
     * <p>One of {@code none}, {@code basic_auth}, {@code session_auth},
     * {@code session_exp_auth}, {@code session_db_auth}. When unset no strategy is
     * active and every request is allowed.
     *
     * @return strategy name (optional)
     */
    Optional<String> type();

    /**
     * Paths exempt from authentication.
     *
     * <p>Entries ending in {@code *} match every path under the prefix before the
     * {@code *}; other entries match a single path. Trailing slashes are ignored.
     *
     * @return excluded path patterns
     */
    @WithDefault("/api/v1/status/,/api/v1/unauthorized/,/api/v1/forbidden/,/api/v1/auth_session/login/,/api/v1/users/")
    List<String> excludedPaths();
}
