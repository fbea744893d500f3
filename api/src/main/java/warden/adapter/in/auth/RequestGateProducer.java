package warden.adapter.in.auth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import warden.config.AuthConfig;
import warden.core.service.auth.RequestGate;

/**
 * CDI producer for the request gate.
 *
 * <p>Combines the strategy selected by {@link AuthStrategyRegistry} with the
 * configured excluded paths.
 */
@ApplicationScoped
public class RequestGateProducer {

    private final AuthStrategyRegistry strategyRegistry;
    private final AuthConfig authConfig;

    @Inject
    public RequestGateProducer(AuthStrategyRegistry strategyRegistry, AuthConfig authConfig) {
        this.strategyRegistry = strategyRegistry;
        this.authConfig = authConfig;
    }

    @Produces
    @Singleton
    public RequestGate requestGate() {
        return new RequestGate(strategyRegistry.active(), authConfig.excludedPaths());
    }
}
