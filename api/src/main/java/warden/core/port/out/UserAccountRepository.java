package warden.core.port.out;

import warden.core.model.auth.UserAccount;

/**
 * Outbound port for creating user accounts.
 */
public interface UserAccountRepository {

    /**
     * Persist a new account and assign it an id.
     *
     * @param email        login email
     * @param passwordHash already hashed secret
     * @return the stored account
     */
    UserAccount create(String email, String passwordHash);
}
