package warden.core.model.auth;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Authentication strategies selectable through {@code warden.auth.type}.
 */
public enum AuthType {
    NONE("none"),
    BASIC("basic_auth"),
    SESSION("session_auth"),
    SESSION_EXP("session_exp_auth"),
    SESSION_DB("session_db_auth");

    private final String value;

    AuthType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Whether strategies of this type issue server-side sessions.
     */
    public boolean usesSessions() {
        return this == SESSION || this == SESSION_EXP || this == SESSION_DB;
    }

    /**
     * Whether sessions of this type carry an expiry duration.
     */
    public boolean expiresSessions() {
        return this == SESSION_EXP || this == SESSION_DB;
    }

    /**
     * Parse a configured value.
     *
     * @param value configured strategy name, e.g. {@code session_exp_auth}
     * @return the matching type
     * @throws IllegalArgumentException if the value names no known strategy
     */
    public static AuthType fromValue(String value) {
        for (AuthType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown auth type '" + value + "', expected one of "
                + Arrays.stream(values()).map(AuthType::value).collect(Collectors.joining(", ")));
    }
}
