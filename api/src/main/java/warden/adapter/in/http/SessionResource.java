package warden.adapter.in.http;

import java.util.Map;
import java.util.Optional;

import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.FormParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.NewCookie;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;

import org.jboss.logging.Logger;

import warden.adapter.in.auth.AuthStrategyRegistry;
import warden.adapter.in.auth.SessionCookieManager;
import warden.core.model.auth.Principal;
import warden.core.model.auth.PrincipalAttribute;
import warden.core.port.out.CredentialStore;
import warden.core.service.session.SessionCreationException;
import warden.spi.SessionStrategy;

/**
 * Login and logout for the session strategies.
 *
 * <p>Both endpoints answer 404 when the active strategy does not issue sessions.
 */
@Path("/api/v1/auth_session")
@Produces(MediaType.APPLICATION_JSON)
public class SessionResource {

    private static final Logger LOG = Logger.getLogger(SessionResource.class);

    private final AuthStrategyRegistry strategyRegistry;
    private final CredentialStore credentialStore;
    private final SessionCookieManager cookieManager;

    @Context
    UriInfo uriInfo;

    @Context
    HttpHeaders httpHeaders;

    @Inject
    public SessionResource(
            AuthStrategyRegistry strategyRegistry,
            CredentialStore credentialStore,
            SessionCookieManager cookieManager) {
        this.strategyRegistry = strategyRegistry;
        this.credentialStore = credentialStore;
        this.cookieManager = cookieManager;
    }

    /**
     * Authenticate with email and password and open a session.
     */
    @POST
    @Path("/login")
    @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
    public Response login(@FormParam("email") String email, @FormParam("password") String password) {
        Optional<SessionStrategy> strategy = strategyRegistry.sessionStrategy();
        if (strategy.isEmpty()) {
            return ErrorResponses.notFound();
        }

        if (email == null || email.isEmpty()) {
            return ErrorResponses.error(Response.Status.BAD_REQUEST, "email missing");
        }
        if (password == null || password.isEmpty()) {
            return ErrorResponses.error(Response.Status.BAD_REQUEST, "password missing");
        }

        Optional<Principal> principal =
                credentialStore.findUnique(PrincipalAttribute.EMAIL, email).principal();
        if (principal.isEmpty()) {
            return ErrorResponses.error(Response.Status.NOT_FOUND, "no user found for this email");
        }
        if (!credentialStore.verifySecret(principal.get(), password)) {
            return ErrorResponses.error(Response.Status.UNAUTHORIZED, "wrong password");
        }

        String token = strategy.get()
                .createSession(principal.get().id())
                .orElseThrow(() -> new SessionCreationException("No session created for " + principal.get().id()));
        LOG.infof("Session opened for principal %s", principal.get().id());

        Response.ResponseBuilder response = Response.ok(principal.get());
        cookieManager
                .createCookie(token, strategy.get().sessionDuration())
                .ifPresent(response::cookie);
        return response.build();
    }

    /**
     * Destroy the session named by the request's session cookie.
     */
    @DELETE
    @Path("/logout")
    public Response logout() {
        Optional<SessionStrategy> strategy = strategyRegistry.sessionStrategy();
        if (strategy.isEmpty()) {
            return ErrorResponses.notFound();
        }

        if (!strategy.get().destroySession(InboundRequestMapper.from(uriInfo, httpHeaders))) {
            return ErrorResponses.notFound();
        }

        Response.ResponseBuilder response = Response.ok(Map.of());
        Optional<NewCookie> logoutCookie = cookieManager.createLogoutCookie();
        logoutCookie.ifPresent(response::cookie);
        return response.build();
    }
}
