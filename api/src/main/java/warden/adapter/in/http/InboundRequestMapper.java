package warden.adapter.in.http;

import java.util.HashMap;
import java.util.Map;

import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.core.Cookie;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.UriInfo;

import warden.core.model.auth.InboundRequest;

/**
 * Converts JAX-RS request views into {@link InboundRequest}.
 *
 * <p>The path is the raw request path, e.g. {@code /api/v1/users/me}, independent
 * of the application root.
 */
public final class InboundRequestMapper {

    private InboundRequestMapper() {}

    public static InboundRequest from(ContainerRequestContext context) {
        return new InboundRequest(
                context.getUriInfo().getRequestUri().getPath(), context.getHeaders(), cookieValues(context.getCookies()));
    }

    public static InboundRequest from(UriInfo uriInfo, HttpHeaders headers) {
        return new InboundRequest(
                uriInfo.getRequestUri().getPath(), headers.getRequestHeaders(), cookieValues(headers.getCookies()));
    }

    private static Map<String, String> cookieValues(Map<String, Cookie> cookies) {
        Map<String, String> values = new HashMap<>();
        if (cookies != null) {
            cookies.forEach((name, cookie) -> {
                if (cookie != null && cookie.getValue() != null) {
                    values.put(name, cookie.getValue());
                }
            });
        }
        return values;
    }
}
