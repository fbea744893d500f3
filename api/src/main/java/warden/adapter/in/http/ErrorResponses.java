package warden.adapter.in.http;

import java.util.Map;

import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

/**
 * JSON error bodies of the form {@code {"error": "..."}}.
 */
public final class ErrorResponses {

    public static final String NOT_FOUND = "Not found";
    public static final String UNAUTHORIZED = "Unauthorized";
    public static final String FORBIDDEN = "Forbidden";

    private ErrorResponses() {}

    public static Response error(Response.Status status, String message) {
        return Response.status(status)
                .type(MediaType.APPLICATION_JSON)
                .entity(Map.of("error", message))
                .build();
    }

    public static Response notFound() {
        return error(Response.Status.NOT_FOUND, NOT_FOUND);
    }
}
