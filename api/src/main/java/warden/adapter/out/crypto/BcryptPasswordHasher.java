package warden.adapter.out.crypto;

import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.security.Security;
import java.security.spec.InvalidKeySpecException;

import jakarta.enterprise.context.ApplicationScoped;

import org.wildfly.security.password.Password;
import org.wildfly.security.password.PasswordFactory;
import org.wildfly.security.password.WildFlyElytronPasswordProvider;
import org.wildfly.security.password.interfaces.BCryptPassword;
import org.wildfly.security.password.spec.EncryptablePasswordSpec;
import org.wildfly.security.password.spec.IteratedSaltedPasswordAlgorithmSpec;
import org.wildfly.security.password.util.ModularCrypt;

import warden.core.port.out.PasswordHasher;

/**
 * BCrypt password hashing via WildFly Elytron.
 *
 * <p>Hashes are encoded in Modular Crypt Format ({@code $2a$10$...}).
 */
@ApplicationScoped
public class BcryptPasswordHasher implements PasswordHasher {

    private static final String BCRYPT_ALGORITHM = BCryptPassword.ALGORITHM_BCRYPT;
    private static final int BCRYPT_COST = 10; // iterations = 2^10
    private static final int SALT_SIZE = 16;

    private final SecureRandom random = new SecureRandom();

    static {
        Security.addProvider(WildFlyElytronPasswordProvider.getInstance());
    }

    @Override
    public String hash(String plainSecret) {
        if (plainSecret == null || plainSecret.isEmpty()) {
            throw new IllegalArgumentException("Password cannot be null or empty");
        }

        try {
            PasswordFactory factory = PasswordFactory.getInstance(BCRYPT_ALGORITHM);

            byte[] salt = new byte[SALT_SIZE];
            random.nextBytes(salt);

            IteratedSaltedPasswordAlgorithmSpec spec = new IteratedSaltedPasswordAlgorithmSpec(BCRYPT_COST, salt);
            EncryptablePasswordSpec encryptSpec = new EncryptablePasswordSpec(plainSecret.toCharArray(), spec);
            Password password = factory.generatePassword(encryptSpec);

            return ModularCrypt.encodeAsString(password);
        } catch (NoSuchAlgorithmException | InvalidKeySpecException e) {
            throw new IllegalStateException("Failed to hash password", e);
        }
    }

    @Override
    public boolean verify(String plainSecret, String hash) {
        if (plainSecret == null || hash == null || hash.isEmpty()) {
            return false;
        }

        try {
            PasswordFactory factory = PasswordFactory.getInstance(BCRYPT_ALGORITHM);
            Password stored = factory.translate(ModularCrypt.decode(hash));
            return factory.verify(stored, plainSecret.toCharArray());
        } catch (NoSuchAlgorithmException | InvalidKeyException | InvalidKeySpecException | IllegalArgumentException e) {
            // Unparseable hash counts as a mismatch
            return false;
        }
    }
}
