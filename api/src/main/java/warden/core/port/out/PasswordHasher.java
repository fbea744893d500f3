package warden.core.port.out;

/**
 * Outbound port for one-way secret hashing.
 */
public interface PasswordHasher {

    /**
     * Hash a plain secret with a fresh salt.
     *
     * @throws IllegalArgumentException if the secret is null or empty
     */
    String hash(String plainSecret);

    /**
     * Verify a plain secret against a stored hash.
     *
     * @return false on mismatch or when the hash cannot be parsed
     */
    boolean verify(String plainSecret, String hash);
}
