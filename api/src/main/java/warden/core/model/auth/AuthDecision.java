package warden.core.model.auth;

import java.util.Optional;

/**
 * Outcome of gating a single inbound request.
 *
 * <p>Only two failure outcomes ever surface to callers:
 * - Unauthorized: no credential was presented at all
 * - Forbidden: a credential was presented but did not resolve to a principal
 */
public sealed interface AuthDecision {

    /**
     * The request may proceed.
     *
     * @param principal the resolved caller, empty when the path did not require authentication
     */
    record Allow(Optional<Principal> principal) implements AuthDecision {
        private static final Allow ANONYMOUS = new Allow(Optional.empty());

        public Allow {
            if (principal == null) {
                principal = Optional.empty();
            }
        }

        public static Allow anonymous() {
            return ANONYMOUS;
        }

        public static Allow as(Principal principal) {
            return new Allow(Optional.of(principal));
        }
    }

    record Unauthorized() implements AuthDecision {
        private static final Unauthorized INSTANCE = new Unauthorized();

        public static Unauthorized instance() {
            return INSTANCE;
        }
    }

    record Forbidden() implements AuthDecision {
        private static final Forbidden INSTANCE = new Forbidden();

        public static Forbidden instance() {
            return INSTANCE;
        }
    }

    default boolean isAllowed() {
        return this instanceof Allow;
    }
}
