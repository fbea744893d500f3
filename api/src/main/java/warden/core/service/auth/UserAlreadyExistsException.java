package warden.core.service.auth;

import warden.core.model.auth.Credentials;

/**
 * Thrown when registering an email that already belongs to an account.
 */
public class UserAlreadyExistsException extends RuntimeException {

    private final String email;

    public UserAlreadyExistsException(String email) {
        super("User " + Credentials.maskIdentifier(email) + " already exists");
        this.email = email;
    }

    public String getEmail() {
        return email;
    }
}
