package gamestream.adapter.out.http;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import gamestream.config.GatewayConfig;
import gamestream.core.model.gateway.GatewayCredentials;

/**
 * Produces configuration beans for injection into core services.
 * This bridges the config mapping to the immutable core model.
 */
@ApplicationScoped
public class ConfigProducer {

    private final GatewayConfig gatewayConfig;

    @Inject
    public ConfigProducer(GatewayConfig gatewayConfig) {
        this.gatewayConfig = gatewayConfig;
    }

    @Produces
    @Singleton
    public GatewayCredentials gatewayCredentials() {
        return new GatewayCredentials(
                gatewayConfig.url().orElse(null), gatewayConfig.token().orElse(null));
    }

    @Produces
    @Singleton
    public GatewayRetryPolicy gatewayRetryPolicy() {
        return GatewayRetryPolicy.from(gatewayConfig.retry());
    }
}
