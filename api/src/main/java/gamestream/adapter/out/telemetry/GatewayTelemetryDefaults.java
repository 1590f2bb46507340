package gamestream.adapter.out.telemetry;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.propagation.TextMapPropagator;
import io.quarkus.arc.DefaultBean;

/**
 * Telemetry beans the gateway client and {@link GatewayMetrics} fall back to when no
 * Quarkus extension registers its own.
 *
 * <p>Gateway spans then go nowhere, but an incoming {@code traceparent} is still forwarded
 * to the gateway in W3C format, and meters stay in memory.
 *
 * @see gamestream.adapter.out.http.GatewayHttpClient
 */
@ApplicationScoped
public class GatewayTelemetryDefaults {

    static final String INSTRUMENTATION_SCOPE = "gamestream.gateway";

    @Produces
    @Singleton
    @DefaultBean
    public MeterRegistry gatewayMeterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Produces
    @Singleton
    @DefaultBean
    public Tracer gatewayTracer() {
        return OpenTelemetry.noop().getTracer(INSTRUMENTATION_SCOPE);
    }

    @Produces
    @Singleton
    @DefaultBean
    public TextMapPropagator gatewayPropagator() {
        return W3CTraceContextPropagator.getInstance();
    }
}
