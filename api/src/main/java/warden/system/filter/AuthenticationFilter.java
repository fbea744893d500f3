package warden.system.filter;

import java.io.IOException;
import java.util.Map;

import jakarta.annotation.Priority;
import jakarta.inject.Inject;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.Provider;

import org.jboss.logging.Logger;

import warden.adapter.in.http.AuthenticatedCaller;
import warden.adapter.in.http.InboundRequestMapper;
import warden.core.model.auth.AuthDecision;
import warden.core.service.auth.RequestGate;

/**
 * JAX-RS filter that gates every request through the {@link RequestGate}.
 *
 * <p>Unauthorized requests are aborted with 401, Forbidden ones with 403. On success
 * the principal is stored as a request property and in {@link AuthenticatedCaller}:
 * <pre>
 * Principal principal = (Principal) requestContext.getProperty(AuthenticationFilter.PRINCIPAL_PROPERTY);
 * </pre>
 */
@Provider
@Priority(Priorities.AUTHENTICATION)
public class AuthenticationFilter implements ContainerRequestFilter {

    private static final Logger LOG = Logger.getLogger(AuthenticationFilter.class);

    /**
     * Request property key for the authenticated Principal.
     */
    public static final String PRINCIPAL_PROPERTY = "warden.auth.principal";

    private final RequestGate gate;
    private final AuthenticatedCaller caller;

    @Inject
    public AuthenticationFilter(RequestGate gate, AuthenticatedCaller caller) {
        this.gate = gate;
        this.caller = caller;
    }

    @Override
    public void filter(ContainerRequestContext requestContext) throws IOException {
        AuthDecision decision = gate.evaluate(InboundRequestMapper.from(requestContext));

        if (decision instanceof AuthDecision.Allow allow) {
            allow.principal().ifPresent(principal -> {
                requestContext.setProperty(PRINCIPAL_PROPERTY, principal);
                caller.set(principal);
            });
            return;
        }

        Response.Status status = decision instanceof AuthDecision.Unauthorized
                ? Response.Status.UNAUTHORIZED
                : Response.Status.FORBIDDEN;
        LOG.debugf("Rejected %s with %d", requestContext.getUriInfo().getRequestUri().getPath(), status.getStatusCode());
        requestContext.abortWith(Response.status(status)
                .type(MediaType.APPLICATION_JSON)
                .entity(Map.of("error", status == Response.Status.UNAUTHORIZED ? "Unauthorized" : "Forbidden"))
                .build());
    }
}
