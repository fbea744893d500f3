package warden.core.port.out;

import warden.core.model.auth.Principal;
import warden.core.model.auth.PrincipalAttribute;
import warden.core.model.auth.PrincipalLookup;

/**
 * Outbound port to the user store that owns principals and their secrets.
 *
 * <p>Calls may block on I/O. Callers never hold a lock across them.
 */
public interface CredentialStore {

    /**
     * Look up the single principal whose attribute equals the given value.
     *
     * @param attribute attribute to match
     * @param value     value to match, compared exactly
     * @return Found, NotFound, or NotUnique
     */
    PrincipalLookup findUnique(PrincipalAttribute attribute, String value);

    /**
     * Verify a secret against the principal's stored hash.
     *
     * @return true only if the principal exists and the secret matches
     */
    boolean verifySecret(Principal principal, String secret);
}
