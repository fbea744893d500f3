package warden.core.model.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("AuthType")
class AuthTypeTest {

    @Test
    @DisplayName("should parse every configured value")
    void shouldParseConfiguredValues() {
        assertEquals(AuthType.NONE, AuthType.fromValue("none"));
        assertEquals(AuthType.BASIC, AuthType.fromValue("basic_auth"));
        assertEquals(AuthType.SESSION, AuthType.fromValue("session_auth"));
        assertEquals(AuthType.SESSION_EXP, AuthType.fromValue("session_exp_auth"));
        assertEquals(AuthType.SESSION_DB, AuthType.fromValue("session_db_auth"));
    }

    @Test
    @DisplayName("should reject unknown values")
    void shouldRejectUnknownValues() {
        var exception = assertThrows(IllegalArgumentException.class, () -> AuthType.fromValue("jwt_auth"));

        assertTrue(exception.getMessage().contains("jwt_auth"));
    }

    @Test
    @DisplayName("should only expire sessions for exp and db variants")
    void shouldOnlyExpireSessionsForExpAndDb() {
        assertFalse(AuthType.SESSION.expiresSessions());
        assertTrue(AuthType.SESSION_EXP.expiresSessions());
        assertTrue(AuthType.SESSION_DB.expiresSessions());
        assertFalse(AuthType.BASIC.usesSessions());
    }
}
