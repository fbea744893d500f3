package warden.core.service.auth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import warden.core.model.auth.PrincipalAttribute;
import warden.core.model.auth.PrincipalLookup;
import warden.core.model.auth.UserAccount;
import warden.core.port.out.CredentialStore;
import warden.core.port.out.PasswordHasher;
import warden.core.port.out.UserAccountRepository;

/**
 * Registers user accounts with hashed passwords.
 */
@ApplicationScoped
public class UserRegistrationService {

    private static final Logger LOG = Logger.getLogger(UserRegistrationService.class);

    private final CredentialStore credentialStore;
    private final UserAccountRepository accountRepository;
    private final PasswordHasher passwordHasher;

    @Inject
    public UserRegistrationService(
            CredentialStore credentialStore, UserAccountRepository accountRepository, PasswordHasher passwordHasher) {
        this.credentialStore = credentialStore;
        this.accountRepository = accountRepository;
        this.passwordHasher = passwordHasher;
    }

    /**
     * Register a new account.
     *
     * @param email    login email, must not already be registered
     * @param password plain password, hashed before storage
     * @return the stored account
     * @throws IllegalArgumentException   if email or password is blank
     * @throws UserAlreadyExistsException if the email is taken
     */
    public UserAccount register(String email, String password) {
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("email missing");
        }
        if (password == null || password.isEmpty()) {
            throw new IllegalArgumentException("password missing");
        }

        PrincipalLookup existing = credentialStore.findUnique(PrincipalAttribute.EMAIL, email);
        if (!(existing instanceof PrincipalLookup.NotFound)) {
            throw new UserAlreadyExistsException(email);
        }

        UserAccount account = accountRepository.create(email, passwordHasher.hash(password));
        LOG.infof("Registered user %s", account.id());
        return account;
    }
}
