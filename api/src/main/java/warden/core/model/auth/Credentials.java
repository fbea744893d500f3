package warden.core.model.auth;

/**
 * Identifier and secret pair extracted from a request.
 *
 * <p>Lives only for the duration of a single authentication attempt.
 *
 * @param identifier the claimed identity (an email address for Basic auth)
 * @param secret     the secret presented to prove the identity
 */
public record Credentials(String identifier, String secret) {

    /**
     * Mask an identifier for log output, keeping its first character and any email domain.
     *
     * <p>{@code alice@example.com} becomes {@code a***@example.com}.
     */
    public static String maskIdentifier(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            return "***";
        }
        int at = identifier.indexOf('@');
        String domain = at >= 0 ? identifier.substring(at) : "";
        return identifier.charAt(0) + "***" + domain;
    }

    @Override
    public String toString() {
        return "Credentials[identifier=" + maskIdentifier(identifier) + ", secret=***]";
    }
}
