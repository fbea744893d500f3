package warden.adapter.in.health;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.Optional;

import org.eclipse.microprofile.health.HealthCheckResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import warden.adapter.in.auth.AuthStrategyRegistry;
import warden.adapter.out.storage.memory.InMemorySessionStorageProvider;
import warden.core.model.auth.AuthType;
import warden.core.service.session.DurableSessionStorage;
import warden.mock.MutableClock;
import warden.mock.TestSessionConfig;
import warden.spi.AuthStrategy;
import warden.spi.SessionStorageProvider;

@DisplayName("SessionStorageHealthCheck")
class SessionStorageHealthCheckTest {

    private AuthStrategyRegistry strategyRegistry;
    private DurableSessionStorage durableStorage;
    private SessionStorageHealthCheck healthCheck;

    @BeforeEach
    void setUp() {
        strategyRegistry = mock(AuthStrategyRegistry.class);
        durableStorage = mock(DurableSessionStorage.class);
        var memoryProvider = new InMemorySessionStorageProvider(
                new TestSessionConfig(), new MutableClock(Instant.parse("2024-01-01T00:00:00Z")));
        healthCheck = new SessionStorageHealthCheck(strategyRegistry, durableStorage, memoryProvider);
    }

    private void activate(AuthType type) {
        var strategy = mock(AuthStrategy.class);
        when(strategy.type()).thenReturn(type);
        when(strategyRegistry.active()).thenReturn(Optional.of(strategy));
    }

    @Test
    @DisplayName("should be up without a strategy")
    void shouldBeUpWithoutStrategy() {
        when(strategyRegistry.active()).thenReturn(Optional.empty());

        var response = healthCheck.call();

        assertEquals(HealthCheckResponse.Status.UP, response.getStatus());
        assertEquals("unset", response.getData().orElseThrow().get("strategy"));
    }

    @Test
    @DisplayName("should report in-memory storage for session_auth")
    void shouldReportMemoryStorage() {
        activate(AuthType.SESSION);

        var response = healthCheck.call();

        assertEquals("session-storage-memory", response.getName());
        assertEquals(HealthCheckResponse.Status.UP, response.getStatus());
    }

    @Test
    @DisplayName("should report the durable store for session_db_auth")
    void shouldReportDurableStore() {
        activate(AuthType.SESSION_DB);
        var provider = mock(SessionStorageProvider.class);
        when(provider.healthCheck()).thenReturn(Optional.of(HealthCheckResponse.named("session-storage-redis")
                .down()
                .build()));
        when(durableStorage.provider()).thenReturn(provider);

        var response = healthCheck.call();

        assertEquals("session-storage-redis", response.getName());
        assertEquals(HealthCheckResponse.Status.DOWN, response.getStatus());
    }

    @Test
    @DisplayName("should be up for basic auth")
    void shouldBeUpForBasicAuth() {
        activate(AuthType.BASIC);

        var response = healthCheck.call();

        assertEquals(HealthCheckResponse.Status.UP, response.getStatus());
        assertTrue(response.getData().isPresent());
    }
}
