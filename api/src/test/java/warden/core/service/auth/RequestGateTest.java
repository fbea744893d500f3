package warden.core.service.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import warden.core.model.auth.AuthDecision;
import warden.core.model.auth.AuthType;
import warden.core.model.auth.InboundRequest;
import warden.core.model.auth.Principal;
import warden.spi.AuthStrategy;

@DisplayName("RequestGate")
class RequestGateTest {

    private static final List<String> EXCLUDED = List.of("/api/v1/status/");

    private AuthStrategy strategy;
    private RequestGate gate;
    private InboundRequest request;

    @BeforeEach
    void setUp() {
        strategy = mock(AuthStrategy.class);
        when(strategy.type()).thenReturn(AuthType.BASIC);
        when(strategy.requireAuth(anyString(), anyList())).thenReturn(true);
        when(strategy.authorizationHeader(any())).thenReturn(Optional.empty());
        when(strategy.sessionCookie(any())).thenReturn(Optional.empty());
        gate = new RequestGate(Optional.of(strategy), EXCLUDED);
        request = InboundRequest.builder("/api/v1/users/me").build();
    }

    @Test
    @DisplayName("should allow everything when no strategy is configured")
    void shouldAllowWhenNoStrategy() {
        var decision = new RequestGate(Optional.empty(), EXCLUDED).evaluate(request);

        assertSame(AuthDecision.Allow.anonymous(), decision);
    }

    @Test
    @DisplayName("should allow excluded paths without inspecting credentials")
    void shouldAllowExcludedPaths() {
        when(strategy.requireAuth("/api/v1/users/me", EXCLUDED)).thenReturn(false);

        var decision = gate.evaluate(request);

        assertTrue(decision.isAllowed());
        verify(strategy, never()).currentPrincipal(any());
    }

    @Test
    @DisplayName("should return Unauthorized when no credential is presented")
    void shouldReturnUnauthorizedWithoutCredentials() {
        var decision = gate.evaluate(request);

        assertInstanceOf(AuthDecision.Unauthorized.class, decision);
        verify(strategy, never()).currentPrincipal(any());
    }

    @Test
    @DisplayName("should return Forbidden when the credential resolves to nobody")
    void shouldReturnForbiddenWhenPrincipalAbsent() {
        when(strategy.authorizationHeader(any())).thenReturn(Optional.of("Bearer whatever"));
        when(strategy.currentPrincipal(any())).thenReturn(Optional.empty());

        assertInstanceOf(AuthDecision.Forbidden.class, gate.evaluate(request));
    }

    @Test
    @DisplayName("should return Forbidden when principal resolution throws")
    void shouldReturnForbiddenWhenResolutionThrows() {
        when(strategy.sessionCookie(any())).thenReturn(Optional.of("token"));
        when(strategy.currentPrincipal(any())).thenThrow(new IllegalStateException("store down"));

        assertInstanceOf(AuthDecision.Forbidden.class, gate.evaluate(request));
    }

    @Test
    @DisplayName("should allow with the resolved principal")
    void shouldAllowWithPrincipal() {
        var principal = new Principal("7", "a@b.com");
        when(strategy.sessionCookie(any())).thenReturn(Optional.of("token"));
        when(strategy.currentPrincipal(any())).thenReturn(Optional.of(principal));

        var decision = gate.evaluate(request);

        var allow = assertInstanceOf(AuthDecision.Allow.class, decision);
        assertEquals(Optional.of(principal), allow.principal());
    }
}
