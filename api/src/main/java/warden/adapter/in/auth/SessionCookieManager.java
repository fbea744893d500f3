package warden.adapter.in.auth;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.core.NewCookie;

import warden.config.SessionConfig;

/**
 * Builds session cookies for login and logout responses.
 *
 * <p>Both methods return empty when no cookie name is configured.
 */
@ApplicationScoped
public class SessionCookieManager {

    private final SessionConfig config;

    @Inject
    public SessionCookieManager(SessionConfig config) {
        this.config = config;
    }

    /**
     * Creates a session cookie carrying a token.
     *
     * @param token    session token
     * @param duration session lifetime; a positive value sets Max-Age
     */
    public Optional<NewCookie> createCookie(String token, Duration duration) {
        return cookieName().map(name -> {
            NewCookie.Builder builder = baseCookie(name);
            builder.value(token);
            if (duration != null && !duration.isNegative() && !duration.isZero()) {
                builder.maxAge((int) Math.min(Integer.MAX_VALUE, duration.toSeconds()));
            }
            return builder.build();
        });
    }

    /**
     * Creates a logout cookie that expires immediately.
     */
    public Optional<NewCookie> createLogoutCookie() {
        return cookieName().map(name -> baseCookie(name).value("").maxAge(0).build());
    }

    /**
     * Gets the configured cookie name.
     */
    public Optional<String> cookieName() {
        return config.cookie().name().filter(name -> !name.isBlank());
    }

    private NewCookie.Builder baseCookie(String name) {
        return new NewCookie.Builder(name)
                .path(config.cookie().path())
                .secure(config.cookie().secure())
                .httpOnly(config.cookie().httpOnly())
                .sameSite(parseSameSite(config.cookie().sameSite()));
    }

    static NewCookie.SameSite parseSameSite(String sameSite) {
        if (sameSite == null) {
            return NewCookie.SameSite.LAX;
        }
        return switch (sameSite.trim().toUpperCase(Locale.ROOT)) {
            case "STRICT" -> NewCookie.SameSite.STRICT;
            case "NONE" -> NewCookie.SameSite.NONE;
            default -> NewCookie.SameSite.LAX;
        };
    }
}
