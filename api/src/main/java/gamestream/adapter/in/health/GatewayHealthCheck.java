package gamestream.adapter.in.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

import gamestream.core.model.gateway.GatewayCredentials;

/**
 * Readiness check for the gateway connection.
 *
 * <p>Reports DOWN when the gateway URL or token is missing, since every game endpoint
 * then answers 503. It does not call the gateway: a slow gateway should show up in the
 * {@code gamestream.gateway.*} metrics, not flip readiness.
 */
@Readiness
@ApplicationScoped
public class GatewayHealthCheck implements HealthCheck {

    private final GatewayCredentials credentials;

    @Inject
    public GatewayHealthCheck(GatewayCredentials credentials) {
        this.credentials = credentials;
    }

    @Override
    public HealthCheckResponse call() {
        HealthCheckResponseBuilder builder = HealthCheckResponse.builder().name("gateway");
        builder.withData("configured", credentials.enabled());
        if (!credentials.baseUrl().isEmpty()) {
            builder.withData("base-url", credentials.baseUrl());
        }
        return credentials.enabled() ? builder.up().build() : builder.down().build();
    }
}
