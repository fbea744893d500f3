package warden.adapter.out.storage.redis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.net.ConnectException;
import java.time.Duration;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.smallrye.mutiny.Uni;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import warden.mock.TestSessionConfig;

@DisplayName("RedisSessionStorageProvider")
@SuppressWarnings("unchecked")
class RedisSessionStorageProviderTest {

    private static final String REACHABILITY_KEY = "warden:session:reachability";

    private ReactiveRedisDataSource dataSource;
    private ReactiveKeyCommands<String> keyCommands;
    private RedisSessionStorageProvider provider;

    @BeforeEach
    void setUp() {
        dataSource = mock(ReactiveRedisDataSource.class);
        keyCommands = mock(ReactiveKeyCommands.class);
        when(dataSource.key(String.class)).thenReturn(keyCommands);
        when(dataSource.value(String.class, String.class)).thenReturn(mock(ReactiveValueCommands.class));
        provider = new RedisSessionStorageProvider(dataSource, new TestSessionConfig().duration(Duration.ofHours(1)));
    }

    @Test
    @DisplayName("should be durable")
    void shouldBeDurable() {
        assertEquals("redis", provider.name());
        assertTrue(provider.durable());
    }

    @Test
    @DisplayName("should not contact redis when constructed")
    void shouldNotContactRedisWhenConstructed() {
        verify(keyCommands, never()).exists(REACHABILITY_KEY);
    }

    @Test
    @DisplayName("should be available when the reachability check answers")
    void shouldBeAvailableWhenRedisAnswers() {
        when(keyCommands.exists(REACHABILITY_KEY)).thenReturn(Uni.createFrom().item(false));

        assertTrue(provider.isAvailable());
    }

    @Test
    @DisplayName("should be unavailable when redis refuses connections")
    void shouldBeUnavailableWhenRedisFails() {
        when(keyCommands.exists(REACHABILITY_KEY))
                .thenReturn(Uni.createFrom().failure(new ConnectException("Connection refused")));

        assertFalse(provider.isAvailable());
    }

    @Test
    @DisplayName("should be unavailable when redis does not answer in time")
    void shouldBeUnavailableOnTimeout() {
        when(keyCommands.exists(REACHABILITY_KEY)).thenReturn(Uni.createFrom().nothing());
        var slowProvider = new RedisSessionStorageProvider(
                dataSource, new TestSessionConfig().timeout(Duration.ofMillis(50)));

        assertFalse(slowProvider.isAvailable());
    }

    @Test
    @DisplayName("should report session store facts when up")
    void shouldReportSessionStoreFactsWhenUp() {
        when(keyCommands.exists(REACHABILITY_KEY)).thenReturn(Uni.createFrom().item(true));

        var response = provider.healthCheck().orElseThrow();
        var data = response.getData().orElseThrow();

        assertEquals("session-storage-redis", response.getName());
        assertEquals(HealthCheckResponse.Status.UP, response.getStatus());
        assertEquals("warden:session:", data.get("keyPrefix"));
        assertEquals("PT1H", data.get("sessionDuration"));
        assertFalse(data.containsKey("error"));
    }

    @Test
    @DisplayName("should report the connection error when down")
    void shouldReportErrorWhenDown() {
        when(keyCommands.exists(REACHABILITY_KEY))
                .thenReturn(Uni.createFrom().failure(new ConnectException("Connection refused")));

        var response = provider.healthCheck().orElseThrow();

        assertEquals(HealthCheckResponse.Status.DOWN, response.getStatus());
        assertTrue(response.getData().orElseThrow().get("error").toString().contains("Connection refused"));
    }

    @Test
    @DisplayName("should create one repository")
    void shouldCreateOneRepository() {
        var repository = provider.createRepository();

        assertInstanceOf(RedisSessionRepository.class, repository);
        assertSame(repository, provider.createRepository());
    }
}
