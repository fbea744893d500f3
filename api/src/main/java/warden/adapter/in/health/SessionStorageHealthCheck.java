package warden.adapter.in.health;

import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import warden.adapter.in.auth.AuthStrategyRegistry;
import warden.adapter.out.storage.memory.InMemorySessionStorageProvider;
import warden.core.model.auth.AuthType;
import warden.core.service.session.DurableSessionStorage;
import warden.spi.AuthStrategy;

/**
 * Readiness of the session storage behind the active strategy.
 *
 * <p>Strategies without sessions always report UP. {@code session_db_auth} reports
 * the durable store's own check.
 */
@Readiness
@ApplicationScoped
public class SessionStorageHealthCheck implements HealthCheck {

    private static final String NAME = "session-storage";

    private final AuthStrategyRegistry strategyRegistry;
    private final DurableSessionStorage durableStorage;
    private final InMemorySessionStorageProvider memoryProvider;

    @Inject
    public SessionStorageHealthCheck(
            AuthStrategyRegistry strategyRegistry,
            DurableSessionStorage durableStorage,
            InMemorySessionStorageProvider memoryProvider) {
        this.strategyRegistry = strategyRegistry;
        this.durableStorage = durableStorage;
        this.memoryProvider = memoryProvider;
    }

    @Override
    public HealthCheckResponse call() {
        Optional<AuthType> type = strategyRegistry.active().map(AuthStrategy::type);
        if (type.isEmpty() || !type.get().usesSessions()) {
            return HealthCheckResponse.named(NAME)
                    .up()
                    .withData("strategy", type.map(AuthType::value).orElse("unset"))
                    .build();
        }

        Optional<HealthCheckResponse> response = type.get() == AuthType.SESSION_DB
                ? durableStorage.provider().healthCheck()
                : memoryProvider.healthCheck();
        return response.orElseGet(() -> HealthCheckResponse.named(NAME)
                .up()
                .withData("strategy", type.get().value())
                .build());
    }
}
