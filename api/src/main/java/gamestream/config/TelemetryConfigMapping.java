package gamestream.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for telemetry.
 *
 * <p>Configuration prefix: {@code gamestream.telemetry}
 */
@ConfigMapping(prefix = "gamestream.telemetry")
public interface TelemetryConfigMapping {

    /**
     * Master switch for telemetry.
     */
    @WithDefault("true")
    boolean enabled();

    MetricsConfig metrics();

    interface MetricsConfig {

        @WithDefault("true")
        boolean enabled();
    }
}
