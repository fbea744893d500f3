package warden.adapter.in.http;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import warden.core.model.auth.Principal;
import warden.core.model.auth.UserAccount;
import warden.core.service.auth.UserRegistrationService;

@DisplayName("UserResource")
class UserResourceTest {

    private UserRegistrationService registrationService;
    private AuthenticatedCaller caller;
    private UserResource resource;

    @BeforeEach
    void setUp() {
        registrationService = mock(UserRegistrationService.class);
        caller = new AuthenticatedCaller();
        resource = new UserResource(registrationService, caller);
    }

    @Test
    @DisplayName("should return the created user")
    void shouldReturnCreatedUser() {
        when(registrationService.register("a@b.com", "pw")).thenReturn(new UserAccount("1", "a@b.com", "$2a$10$x"));

        var response = resource.register("a@b.com", "pw");

        assertEquals(200, response.getStatus());
        assertEquals(Map.of("id", "1", "email", "a@b.com", "message", "user created"), response.getEntity());
    }

    @Test
    @DisplayName("should return the authenticated caller")
    void shouldReturnAuthenticatedCaller() {
        caller.set(new Principal("7", "a@b.com"));

        var response = resource.me();

        assertEquals(200, response.getStatus());
        assertEquals(new Principal("7", "a@b.com"), response.getEntity());
    }

    @Test
    @DisplayName("should answer 404 without an authenticated caller")
    void shouldAnswer404WithoutCaller() {
        var response = resource.me();

        assertEquals(404, response.getStatus());
        assertEquals(Map.of("error", "Not found"), response.getEntity());
    }
}
