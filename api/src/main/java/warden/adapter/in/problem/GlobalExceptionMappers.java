package warden.adapter.in.problem;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.Response;

import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import warden.adapter.in.http.ErrorResponses;
import warden.core.model.auth.Credentials;
import warden.core.service.auth.UserAlreadyExistsException;
import warden.core.service.session.SessionCreationException;

/**
 * Global exception mappers converting domain exceptions into {@code {"error": ...}} responses.
 */
@ApplicationScoped
public class GlobalExceptionMappers {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMappers.class);

    @ServerExceptionMapper
    public Response mapUserAlreadyExistsException(UserAlreadyExistsException e) {
        LOG.debugv("Duplicate registration: {0}", Credentials.maskIdentifier(e.getEmail()));
        return ErrorResponses.error(Response.Status.BAD_REQUEST, "email already registered");
    }

    @ServerExceptionMapper
    public Response mapIllegalArgumentException(IllegalArgumentException e) {
        LOG.debugv("Validation error: {0}", e.getMessage());
        return ErrorResponses.error(Response.Status.BAD_REQUEST, e.getMessage());
    }

    @ServerExceptionMapper
    public Response mapSessionCreationException(SessionCreationException e) {
        LOG.errorv(e, "Session creation failed: {0}", e.getMessage());
        return ErrorResponses.error(Response.Status.INTERNAL_SERVER_ERROR, "Failed to create session");
    }
}
