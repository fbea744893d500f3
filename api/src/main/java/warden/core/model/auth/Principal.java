package warden.core.model.auth;

/**
 * Resolved identity of an authenticated caller.
 *
 * <p>Principals are owned by the credential store. The authentication layer
 * only resolves them and never mutates them.
 *
 * @param id    stable principal identifier
 * @param email the principal's email address
 */
public record Principal(String id, String email) {

    public Principal {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Principal id cannot be null or blank");
        }
    }
}
