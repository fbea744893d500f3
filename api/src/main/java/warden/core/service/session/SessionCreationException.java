package warden.core.service.session;

/**
 * Thrown when a session cannot be stored.
 */
public class SessionCreationException extends RuntimeException {

    public SessionCreationException(String message) {
        super(message);
    }

    public SessionCreationException(String message, Throwable cause) {
        super(message, cause);
    }
}
