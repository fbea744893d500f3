package warden.adapter.in.auth;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.Optional;

import org.jboss.logging.Logger;

import warden.core.model.auth.AuthType;
import warden.core.model.auth.Credentials;
import warden.core.model.auth.InboundRequest;
import warden.core.model.auth.Principal;
import warden.core.model.auth.PrincipalAttribute;
import warden.core.model.auth.PrincipalLookup;
import warden.core.port.out.CredentialStore;
import warden.core.service.auth.AuthStrategySupport;
import warden.spi.AuthStrategy;

/**
 * Strategy for HTTP Basic authentication against the credential store.
 *
 * <p>Example:
 * <pre>
 * Authorization: Basic YUBiLmNvbTpwdw==
 * </pre>
 *
 * <p>The identifier is matched against principal emails. Every malformed step
 * (wrong scheme, invalid Base64, invalid UTF-8, missing colon) yields no principal.
 */
public class BasicAuthStrategy implements AuthStrategy {

    private static final Logger LOG = Logger.getLogger(BasicAuthStrategy.class);
    private static final String BASIC_PREFIX = "Basic ";

    private final AuthStrategySupport support;
    private final CredentialStore credentialStore;

    public BasicAuthStrategy(AuthStrategySupport support, CredentialStore credentialStore) {
        this.support = support;
        this.credentialStore = credentialStore;
    }

    @Override
    public AuthType type() {
        return AuthType.BASIC;
    }

    @Override
    public boolean requireAuth(String path, List<String> excludedPaths) {
        return support.requireAuth(path, excludedPaths);
    }

    @Override
    public Optional<String> authorizationHeader(InboundRequest request) {
        return support.authorizationHeader(request);
    }

    @Override
    public Optional<String> sessionCookie(InboundRequest request) {
        return support.sessionCookie(request);
    }

    @Override
    public Optional<Principal> currentPrincipal(InboundRequest request) {
        return authorizationHeader(request)
                .flatMap(this::extractBase64AuthorizationHeader)
                .flatMap(this::decodeBase64AuthorizationHeader)
                .flatMap(this::extractUserCredentials)
                .flatMap(this::userObjectFromCredentials);
    }

    /**
     * Strip the {@code Basic } scheme from a header value.
     *
     * @return the Base64 payload, or empty if the scheme does not match exactly
     */
    public Optional<String> extractBase64AuthorizationHeader(String header) {
        if (header == null || !header.startsWith(BASIC_PREFIX)) {
            return Optional.empty();
        }
        return Optional.of(header.substring(BASIC_PREFIX.length()));
    }

    /**
     * Decode a Base64 payload to UTF-8 text.
     *
     * @return the decoded text, or empty if the payload is not valid Base64 or not valid UTF-8
     */
    public Optional<String> decodeBase64AuthorizationHeader(String encoded) {
        if (encoded == null) {
            return Optional.empty();
        }
        try {
            byte[] bytes = Base64.getDecoder().decode(encoded);
            return Optional.of(StandardCharsets.UTF_8
                    .newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString());
        } catch (IllegalArgumentException | CharacterCodingException e) {
            LOG.debugf("Rejected Basic payload: %s", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Split decoded credentials on the first colon.
     *
     * <p>The secret may itself contain colons.
     *
     * @return identifier and secret, or empty if there is no colon
     */
    public Optional<Credentials> extractUserCredentials(String decoded) {
        if (decoded == null) {
            return Optional.empty();
        }
        int colon = decoded.indexOf(':');
        if (colon < 0) {
            return Optional.empty();
        }
        return Optional.of(new Credentials(decoded.substring(0, colon), decoded.substring(colon + 1)));
    }

    /**
     * Resolve credentials to a principal by unique email lookup and secret verification.
     *
     * @return the principal, or empty on NotFound, NotUnique, or a wrong secret
     */
    public Optional<Principal> userObjectFromCredentials(Credentials credentials) {
        if (credentials == null || credentials.identifier() == null || credentials.secret() == null) {
            return Optional.empty();
        }

        PrincipalLookup lookup = credentialStore.findUnique(PrincipalAttribute.EMAIL, credentials.identifier());
        Optional<Principal> principal = lookup.principal();
        if (principal.isEmpty()) {
            LOG.debugf(
                    "No unique principal for Basic identifier %s",
                    Credentials.maskIdentifier(credentials.identifier()));
            return Optional.empty();
        }

        if (!credentialStore.verifySecret(principal.get(), credentials.secret())) {
            LOG.debugf("Secret mismatch for principal %s", principal.get().id());
            return Optional.empty();
        }
        return principal;
    }
}
