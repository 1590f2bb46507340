package gamestream.adapter.out.telemetry;

import java.util.concurrent.TimeUnit;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import gamestream.config.TelemetryConfigMapping;
import gamestream.core.model.gateway.GatewayResult;
import gamestream.core.port.out.Metrics;

/**
 * Records gateway metrics using Micrometer.
 *
 * <p>All methods are no-ops when telemetry is disabled, making it safe
 * to inject and call without checking configuration at each call site.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code gamestream.gateway.calls.total} - Gateway calls by method, path, status class</li>
 *   <li>{@code gamestream.gateway.latency} - Gateway response latency per attempt</li>
 *   <li>{@code gamestream.gateway.retries.total} - Retries of safe methods</li>
 *   <li>{@code gamestream.gateway.failures.total} - Transport failures after retries</li>
 *   <li>{@code gamestream.results.total} - Use case outcomes by operation and result type</li>
 * </ul>
 */
@ApplicationScoped
public class GatewayMetrics implements Metrics {

    private final MeterRegistry registry;
    private final boolean enabled;

    @Inject
    public GatewayMetrics(MeterRegistry registry, TelemetryConfigMapping config) {
        this.registry = registry;
        this.enabled = config != null && config.enabled() && config.metrics().enabled();
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void recordGatewayCall(String method, String path, int statusCode, long latencyMs) {
        if (!enabled) {
            return;
        }

        Counter.builder("gamestream.gateway.calls.total")
                .description("Total number of gateway calls, one per attempt")
                .tag("method", method)
                .tag("path", path)
                .tag("status", String.valueOf(statusCode))
                .tag("status_class", statusClass(statusCode))
                .register(registry)
                .increment();

        Timer.builder("gamestream.gateway.latency")
                .description("Time to receive a response from the gateway")
                .tag("method", method)
                .tag("path", path)
                .tag("status_class", statusClass(statusCode))
                .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                .register(registry)
                .record(latencyMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void recordRetry(String method, String path, int attempt) {
        if (!enabled) {
            return;
        }

        Counter.builder("gamestream.gateway.retries.total")
                .description("Retries of safe gateway calls")
                .tag("method", method)
                .tag("path", path)
                .register(registry)
                .increment();
    }

    @Override
    public void recordFailure(String method, String path, String errorType) {
        if (!enabled) {
            return;
        }

        Counter.builder("gamestream.gateway.failures.total")
                .description("Gateway calls that failed at the transport level after retries")
                .tag("method", method)
                .tag("path", path)
                .tag("error_type", errorType)
                .register(registry)
                .increment();
    }

    @Override
    public void recordResult(String operation, GatewayResult<?> result) {
        if (!enabled) {
            return;
        }

        Counter.builder("gamestream.results.total")
                .description("Outcomes of gateway-backed operations")
                .tag("operation", operation)
                .tag("result", resultType(result))
                .register(registry)
                .increment();
    }

    private static String resultType(GatewayResult<?> result) {
        if (result instanceof GatewayResult.Success) {
            return "success";
        }
        if (result instanceof GatewayResult.GatewayDisabled) {
            return "gateway_disabled";
        }
        if (result instanceof GatewayResult.InvalidInput) {
            return "invalid_input";
        }
        if (result instanceof GatewayResult.UpstreamFailure) {
            return "upstream_failure";
        }
        return "upstream_unavailable";
    }

    private static String statusClass(int statusCode) {
        return switch (statusCode / 100) {
            case 1 -> "1xx";
            case 2 -> "2xx";
            case 3 -> "3xx";
            case 4 -> "4xx";
            case 5 -> "5xx";
            default -> "unknown";
        };
    }
}
