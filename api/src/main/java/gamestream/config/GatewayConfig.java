package gamestream.config;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the upstream gateway connection.
 *
 * <p>Configuration prefix: {@code gamestream.gateway}
 *
 * <p>The gateway is considered enabled only when both {@link #url()} and
 * {@link #token()} are present and non-blank. Both values can also come from
 * the snap config file, see {@link GatewayConfigFileSource}.
 *
 * <h2>Example Configuration</h2>
 * <pre>
 * gamestream.gateway.url=https://gateway.example.com:4000
 * gamestream.gateway.token=AgEUYW5ib3gt...
 * gamestream.gateway.request-timeout=PT10S
 * </pre>
 *
 * <h2>Environment Variables</h2>
 * <pre>
 * GAMESTREAM_GATEWAY_URL=https://gateway.example.com:4000
 * GAMESTREAM_GATEWAY_TOKEN=AgEUYW5ib3gt...
 * </pre>
 */
@ConfigMapping(prefix = "gamestream.gateway")
public interface GatewayConfig {

    /**
     * Base URL of the gateway, without a trailing path.
     */
    Optional<String> url();

    /**
     * Macaroon token sent as {@code Authorization: macaroon root=<token>}.
     */
    Optional<String> token();

    /**
     * Maximum time to establish a TCP connection to the gateway.
     *
     * @return Connect timeout duration (default: 5 seconds)
     */
    @WithDefault("PT5S")
    Duration connectTimeout();

    /**
     * Maximum time to wait for a single gateway response.
     *
     * <p>Applied per attempt, so a retried GET may take longer overall. This is the Vert.x
     * request idle timeout: it fires when no data arrives for this long, so a gateway that
     * keeps trickling bytes is not cut off by it.
     *
     * @return Request timeout duration (default: 10 seconds)
     */
    @WithDefault("PT10S")
    Duration requestTimeout();

    /**
     * Retry settings for safe methods.
     */
    Retry retry();

    /**
     * TLS settings for the gateway connection.
     */
    Tls tls();

    interface Retry {

        /**
         * Maximum number of retries after the first attempt.
         *
         * @return Max retries (default: 3)
         */
        @WithDefault("3")
        int maxRetries();

        /**
         * Delay before the first retry. Doubled for each following retry.
         *
         * @return Initial backoff (default: 1 second)
         */
        @WithDefault("PT1S")
        Duration initialBackoff();

        /**
         * Upstream status codes that trigger a retry for safe methods.
         */
        @WithDefault("500,502,503,504")
        Set<Integer> retryableStatuses();
    }

    interface Tls {

        /**
         * Accept any certificate presented by the gateway.
         *
         * <p>Gateways deployed by the appliance use self-signed certificates, so
         * verification is off by default. A WARN is logged at startup whenever
         * this is enabled. Production deployments with a proper certificate
         * should set this to {@code false}.
         *
         * @return true to skip certificate and host verification (default: true)
         */
        @WithDefault("true")
        boolean trustAll();
    }
}
