package warden.core.service.session;

import java.util.UUID;
import java.util.regex.Pattern;

import jakarta.enterprise.context.ApplicationScoped;

/**
 * Generate cryptographically secure session tokens.
 *
 * <p>Tokens are random (version 4) UUIDs: 122 random bits from
 * {@link java.security.SecureRandom}, rendered in canonical lowercase form.
 */
@ApplicationScoped
public class SessionIdGenerator {

    private static final Pattern CANONICAL_UUID =
            Pattern.compile("^[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}$");

    /**
     * Generate a new session token.
     *
     * @return a canonical textual UUID (36 characters)
     */
    public String generate() {
        return UUID.randomUUID().toString();
    }

    /**
     * Check whether a value has the shape of a generated token.
     */
    public boolean isWellFormed(String token) {
        return token != null && CANONICAL_UUID.matcher(token).matches();
    }

    /**
     * Shorten a token for log output.
     */
    public static String mask(String token) {
        if (token == null || token.length() < 8) {
            return "INVALID";
        }
        return token.substring(0, 8) + "...";
    }
}
