package gamestream.adapter.in.bootstrap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import io.quarkus.runtime.StartupEvent;
import org.jboss.logging.Logger;

import gamestream.config.GatewayConfig;
import gamestream.core.model.gateway.GatewayCredentials;

/**
 * Reports the gateway configuration on application startup.
 *
 * <p>A missing gateway is not fatal: the service starts and answers 503 on the game
 * endpoints until it is configured. The token is never logged.
 */
@ApplicationScoped
public class GatewayStartupCheck {

    private static final Logger LOG = Logger.getLogger(GatewayStartupCheck.class);

    private final GatewayCredentials credentials;
    private final GatewayConfig config;

    @Inject
    public GatewayStartupCheck(GatewayCredentials credentials, GatewayConfig config) {
        this.credentials = credentials;
        this.config = config;
    }

    void onStart(@Observes StartupEvent event) {
        if (!credentials.enabled()) {
            LOG.warn("========================================");
            LOG.warn("No gateway connected: game endpoints will answer 503");
            LOG.warn("Set gateway-url and gateway-token in the config file,");
            LOG.warn("or GAMESTREAM_GATEWAY_URL and GAMESTREAM_GATEWAY_TOKEN");
            LOG.warn("========================================");
            return;
        }

        LOG.infov(
                "Gateway connected: {0} (request timeout {1}, {2} retries for safe methods)",
                credentials.baseUrl(),
                config.requestTimeout(),
                config.retry().maxRetries());

        if (config.tls().trustAll()) {
            LOG.warn("TLS certificate verification is DISABLED for gateway calls "
                    + "(gamestream.gateway.tls.trust-all=true). Disable it once the gateway has a trusted certificate.");
        }
    }
}
