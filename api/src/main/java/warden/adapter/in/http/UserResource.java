package warden.adapter.in.http;

import java.util.LinkedHashMap;
import java.util.Map;

import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.FormParam;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import warden.core.model.auth.UserAccount;
import warden.core.service.auth.UserRegistrationService;

/**
 * User registration and lookup of the authenticated caller.
 */
@Path("/api/v1/users")
@Produces(MediaType.APPLICATION_JSON)
public class UserResource {

    private final UserRegistrationService registrationService;
    private final AuthenticatedCaller caller;

    @Inject
    public UserResource(UserRegistrationService registrationService, AuthenticatedCaller caller) {
        this.registrationService = registrationService;
        this.caller = caller;
    }

    /**
     * Register a new user.
     *
     * <p>Duplicate emails and missing fields are mapped to 400 by {@code GlobalExceptionMappers}.
     */
    @POST
    @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
    public Response register(@FormParam("email") String email, @FormParam("password") String password) {
        UserAccount account = registrationService.register(email, password);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("id", account.id());
        body.put("email", account.email());
        body.put("message", "user created");
        return Response.ok(body).build();
    }

    /**
     * Return the principal attached to the current request.
     */
    @GET
    @Path("/me")
    public Response me() {
        return caller.principal()
                .map(principal -> Response.ok(principal).build())
                .orElseGet(ErrorResponses::notFound);
    }
}
