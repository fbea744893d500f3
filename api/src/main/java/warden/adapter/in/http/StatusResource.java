package warden.adapter.in.http;

import java.util.Map;

import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

/**
 * Status endpoint and fixed error endpoints, all excluded from authentication by default.
 */
@Path("/api/v1")
@Produces(MediaType.APPLICATION_JSON)
public class StatusResource {

    @GET
    @Path("/status")
    public Map<String, String> status() {
        return Map.of("status", "OK");
    }

    @GET
    @Path("/unauthorized")
    public Response unauthorized() {
        return ErrorResponses.error(Response.Status.UNAUTHORIZED, ErrorResponses.UNAUTHORIZED);
    }

    @GET
    @Path("/forbidden")
    public Response forbidden() {
        return ErrorResponses.error(Response.Status.FORBIDDEN, ErrorResponses.FORBIDDEN);
    }
}
