package warden.core.model.auth;

/**
 * Stored user record backing a {@link Principal}.
 *
 * @param id           principal identifier
 * @param email        login email
 * @param passwordHash hashed secret in Modular Crypt Format
 */
public record UserAccount(String id, String email, String passwordHash) {

    public Principal toPrincipal() {
        return new Principal(id, email);
    }

    @Override
    public String toString() {
        return "UserAccount[id=" + id + ", email=" + email + "]";
    }
}
