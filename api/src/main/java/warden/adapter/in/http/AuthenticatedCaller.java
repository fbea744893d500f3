package warden.adapter.in.http;

import java.util.Optional;

import jakarta.enterprise.context.RequestScoped;

import warden.core.model.auth.Principal;

/**
 * Holds the principal the authentication filter resolved for the current request.
 */
@RequestScoped
public class AuthenticatedCaller {

    private Principal principal;

    public Optional<Principal> principal() {
        return Optional.ofNullable(principal);
    }

    public void set(Principal principal) {
        this.principal = principal;
    }
}
