package warden.core.model.auth;

import java.util.Optional;

/**
 * Result of a unique principal lookup.
 *
 * <p>This is a sealed interface with three possible outcomes:
 * - Found: exactly one principal matched
 * - NotFound: nothing matched
 * - NotUnique: more than one principal matched
 */
public sealed interface PrincipalLookup {

    /**
     * Return the principal if exactly one matched.
     */
    default Optional<Principal> principal() {
        return Optional.empty();
    }

    record Found(Principal value) implements PrincipalLookup {
        public Found {
            if (value == null) {
                throw new IllegalArgumentException("Principal cannot be null");
            }
        }

        @Override
        public Optional<Principal> principal() {
            return Optional.of(value);
        }
    }

    record NotFound() implements PrincipalLookup {
        private static final NotFound INSTANCE = new NotFound();

        public static NotFound instance() {
            return INSTANCE;
        }
    }

    record NotUnique(int matches) implements PrincipalLookup {}
}
