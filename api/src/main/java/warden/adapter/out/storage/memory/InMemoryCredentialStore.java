package warden.adapter.out.storage.memory;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import warden.core.model.auth.Principal;
import warden.core.model.auth.PrincipalAttribute;
import warden.core.model.auth.PrincipalLookup;
import warden.core.model.auth.UserAccount;
import warden.core.port.out.CredentialStore;
import warden.core.port.out.PasswordHasher;
import warden.core.port.out.UserAccountRepository;
import warden.core.service.auth.UserAlreadyExistsException;

/**
 * In-memory user store.
 *
 * <p>Accounts receive random UUID ids that are never reissued, so a session
 * persisted before a restart cannot resolve to an account registered after it.
 * Emails are unique across accounts.
 */
@ApplicationScoped
public class InMemoryCredentialStore implements CredentialStore, UserAccountRepository {

    private static final Logger LOG = Logger.getLogger(InMemoryCredentialStore.class);

    private final Map<String, UserAccount> accounts = new ConcurrentHashMap<>();
    private final PasswordHasher passwordHasher;

    @Inject
    public InMemoryCredentialStore(PasswordHasher passwordHasher) {
        this.passwordHasher = passwordHasher;
    }

    @Override
    public PrincipalLookup findUnique(PrincipalAttribute attribute, String value) {
        if (attribute == null || value == null) {
            return PrincipalLookup.NotFound.instance();
        }

        List<UserAccount> matches = accounts.values().stream()
                .filter(account -> value.equals(attributeOf(account, attribute)))
                .toList();

        if (matches.isEmpty()) {
            return PrincipalLookup.NotFound.instance();
        }
        if (matches.size() > 1) {
            LOG.warnf("Lookup by %s matched %d accounts", attribute, matches.size());
            return new PrincipalLookup.NotUnique(matches.size());
        }
        return new PrincipalLookup.Found(matches.get(0).toPrincipal());
    }

    @Override
    public boolean verifySecret(Principal principal, String secret) {
        if (principal == null || secret == null) {
            return false;
        }
        UserAccount account = accounts.get(principal.id());
        if (account == null) {
            return false;
        }
        return passwordHasher.verify(secret, account.passwordHash());
    }

    @Override
    public synchronized UserAccount create(String email, String passwordHash) {
        boolean taken = accounts.values().stream().anyMatch(account -> account.email().equals(email));
        if (taken) {
            throw new UserAlreadyExistsException(email);
        }
        String id = UUID.randomUUID().toString();
        UserAccount account = new UserAccount(id, email, passwordHash);
        accounts.put(id, account);
        LOG.debugf("Created account %s", id);
        return account;
    }

    /**
     * Return the number of stored accounts (for testing).
     */
    public int getAccountCount() {
        return accounts.size();
    }

    private static String attributeOf(UserAccount account, PrincipalAttribute attribute) {
        return switch (attribute) {
            case ID -> account.id();
            case EMAIL -> account.email();
        };
    }
}
