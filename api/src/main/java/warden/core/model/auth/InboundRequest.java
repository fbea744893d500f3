package warden.core.model.auth;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Framework-neutral view of the parts of an HTTP request that authentication reads.
 *
 * <p>Header names are matched case-insensitively, cookie names exactly.
 *
 * @param path    request path, e.g. {@code /api/v1/users/me}
 * @param headers request headers
 * @param cookies cookie values by name
 */
public record InboundRequest(String path, Map<String, List<String>> headers, Map<String, String> cookies) {

    public static final String AUTHORIZATION = "Authorization";

    public InboundRequest {
        Map<String, List<String>> normalized = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            headers.forEach((name, values) -> {
                if (name != null && values != null) {
                    normalized.put(name, List.copyOf(values));
                }
            });
        }
        headers = Collections.unmodifiableMap(normalized);
        cookies = cookies != null ? Map.copyOf(cookies) : Map.of();
    }

    /**
     * Return the first value of a header.
     */
    public Optional<String> header(String name) {
        List<String> values = headers.get(name);
        if (values == null || values.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(values.get(0));
    }

    /**
     * Return the value of a cookie.
     */
    public Optional<String> cookie(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(cookies.get(name));
    }

    public static Builder builder(String path) {
        return new Builder(path);
    }

    public static final class Builder {
        private final String path;
        private final Map<String, List<String>> headers = new HashMap<>();
        private final Map<String, String> cookies = new HashMap<>();

        private Builder(String path) {
            this.path = path;
        }

        public Builder header(String name, String value) {
            headers.put(name, List.of(value));
            return this;
        }

        public Builder authorization(String value) {
            return header(AUTHORIZATION, value);
        }

        public Builder cookie(String name, String value) {
            cookies.put(name, value);
            return this;
        }

        public InboundRequest build() {
            return new InboundRequest(path, headers, cookies);
        }
    }
}
